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
 * Flags a bureau score that barely moved while disputes were in flight.
 */
@Component
@Order(30)
public class StagnationAnomalyCheck implements AnomalyCheck {

    private final ScoreAnalyticsProperties props;

    public StagnationAnomalyCheck(ScoreAnalyticsProperties props) {
        this.props = props;
    }

    @Override
    public List<AnomalyAlertDTO> check(AnomalyContext context) {
        if (context.disputesSentInWindow() < 1) {
            return List.of();
        }

        List<AnomalyAlertDTO> alerts = new ArrayList<>();
        for (Map.Entry<Bureau, List<ScoreObservation>> entry : context.byBureau().entrySet()) {
            List<ScoreObservation> history = entry.getValue();
            if (history.size() < 2) {
                continue;
            }

            int min = history.stream().mapToInt(ScoreObservation::getScore).min().orElse(0);
            int max = history.stream().mapToInt(ScoreObservation::getScore).max().orElse(0);
            int range = max - min;
            if (range >= props.stagnationRange()) {
                continue;
            }

            Bureau bureau = entry.getKey();
            alerts.add(AnomalyAlertDTO.builder()
                    .type(AnomalyType.STAGNATION)
                    .severity(AlertSeverity.INFO)
                    .bureau(bureau)
                    .message(String.format(
                            "%s score moved only %d points over %d readings since %s despite %d dispute(s) sent",
                            bureau.getDisplayName(), range, history.size(), context.windowStart(), context.disputesSentInWindow()))
                    .recommendation("Escalate to the next dispute round or switch to an alternative dispute argument")
                    .build());
        }
        return alerts;
    }
}
