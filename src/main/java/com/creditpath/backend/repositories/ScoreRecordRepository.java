package com.creditpath.backend.repositories;

import java.util.List;
import java.util.UUID;

import com.creditpath.backend.entities.NegativeItem;
import com.creditpath.backend.entities.ScoreObservation;
import com.creditpath.backend.enums.Bureau;

/**
 * Read access to a client's score history and negative items. Implemented by
 * the persistence layer; this module only consumes it.
 */
public interface ScoreRecordRepository {

    /**
     * Observations for one bureau, oldest first.
     */
    List<ScoreObservation> findByClientIdAndBureauOrderByObservedDateAsc(UUID clientId, Bureau bureau);

    /**
     * Observations across all bureaus, oldest first.
     */
    List<ScoreObservation> findByClientIdOrderByObservedDateAsc(UUID clientId);

    List<NegativeItem> findItemsByClientId(UUID clientId);
}
