package com.creditpath.backend.services.anomalies;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.creditpath.backend.config.ScoreAnalyticsProperties;
import com.creditpath.backend.dto.anomaly.AnomalyAlertDTO;
import com.creditpath.backend.entities.ScoreObservation;
import com.creditpath.backend.enums.AlertSeverity;
import com.creditpath.backend.enums.AnomalyType;

/**
 * Flags a wide gap between the bureaus' latest scores, which usually means one
 * bureau carries items the others don't.
 */
@Component
@Order(20)
public class BureauInconsistencyAnomalyCheck implements AnomalyCheck {

    private final ScoreAnalyticsProperties props;

    public BureauInconsistencyAnomalyCheck(ScoreAnalyticsProperties props) {
        this.props = props;
    }

    @Override
    public List<AnomalyAlertDTO> check(AnomalyContext context) {
        List<ScoreObservation> latest = new ArrayList<>();
        for (List<ScoreObservation> history : context.byBureau().values()) {
            if (!history.isEmpty()) {
                latest.add(history.get(history.size() - 1));
            }
        }
        if (latest.size() < 2) {
            return List.of();
        }

        ScoreObservation highest = latest.stream().max(Comparator.comparingInt(ScoreObservation::getScore)).orElseThrow();
        ScoreObservation lowest = latest.stream().min(Comparator.comparingInt(ScoreObservation::getScore)).orElseThrow();
        int spread = highest.getScore() - lowest.getScore();
        if (spread <= props.bureauSpreadThreshold()) {
            return List.of();
        }

        return List.of(AnomalyAlertDTO.builder()
                .type(AnomalyType.BUREAU_INCONSISTENCY)
                .severity(spread > props.bureauSpreadCriticalThreshold() ? AlertSeverity.CRITICAL : AlertSeverity.WARNING)
                .message(String.format("Scores differ by %d points across bureaus (%s %d, %s %d)",
                        spread,
                        highest.getBureau().getDisplayName(), highest.getScore(),
                        lowest.getBureau().getDisplayName(), lowest.getScore()))
                .recommendation(String.format(
                        "Compare the %s report against the others; items reported by only one bureau are strong dispute candidates",
                        lowest.getBureau().getDisplayName()))
                .build());
    }
}
