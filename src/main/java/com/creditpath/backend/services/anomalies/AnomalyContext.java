package com.creditpath.backend.services.anomalies;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import com.creditpath.backend.entities.NegativeItem;
import com.creditpath.backend.entities.ScoreObservation;
import com.creditpath.backend.enums.Bureau;

/**
 * Snapshot the anomaly checks read from. Observations are already restricted to
 * [windowStart, asOf] and ordered oldest first.
 */
public record AnomalyContext(
        List<ScoreObservation> windowObservations,
        Map<Bureau, List<ScoreObservation>> byBureau,
        List<NegativeItem> items,
        int disputesSentInWindow,
        LocalDate windowStart,
        LocalDate asOf
) {
}
