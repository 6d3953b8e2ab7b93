package com.creditpath.backend.services.anomalies;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.creditpath.backend.config.ScoreAnalyticsProperties;
import com.creditpath.backend.dto.anomaly.AnomalyAlertDTO;
import com.creditpath.backend.entities.ScoreObservation;
import com.creditpath.backend.enums.AlertSeverity;
import com.creditpath.backend.enums.AnomalyType;
import com.creditpath.backend.enums.Bureau;

/**
 * Flags a bureau score falling sharply between two consecutive readings.
 */
@Component
@Order(10)
public class SuddenDropAnomalyCheck implements AnomalyCheck {

    private final ScoreAnalyticsProperties props;

    public SuddenDropAnomalyCheck(ScoreAnalyticsProperties props) {
        this.props = props;
    }

    @Override
    public List<AnomalyAlertDTO> check(AnomalyContext context) {
        List<AnomalyAlertDTO> alerts = new ArrayList<>();

        for (Map.Entry<Bureau, List<ScoreObservation>> entry : context.byBureau().entrySet()) {
            List<ScoreObservation> history = entry.getValue();
            for (int i = 1; i < history.size(); i++) {
                ScoreObservation before = history.get(i - 1);
                ScoreObservation after = history.get(i);
                int drop = before.getScore() - after.getScore();
                if (drop <= props.suddenDropThreshold()) {
                    continue;
                }

                Bureau bureau = entry.getKey();
                alerts.add(AnomalyAlertDTO.builder()
                        .type(AnomalyType.SUDDEN_DROP)
                        .severity(drop > props.suddenDropCriticalThreshold() ? AlertSeverity.CRITICAL : AlertSeverity.WARNING)
                        .bureau(bureau)
                        .message(String.format("%s score dropped %d points (from %d to %d) between %s and %s",
                                bureau.getDisplayName(), drop, before.getScore(), after.getScore(),
                                before.getObservedDate(), after.getObservedDate()))
                        .recommendation(String.format(
                                "Pull a fresh %s report and look for new negative items, hard inquiries or reporting errors",
                                bureau.getDisplayName()))
                        .build());
            }
        }

        return alerts;
    }
}
