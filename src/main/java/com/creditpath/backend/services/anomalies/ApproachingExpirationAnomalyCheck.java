package com.creditpath.backend.services.anomalies;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.creditpath.backend.config.ScoreAnalyticsProperties;
import com.creditpath.backend.dto.anomaly.AnomalyAlertDTO;
import com.creditpath.backend.entities.NegativeItem;
import com.creditpath.backend.enums.AlertSeverity;
import com.creditpath.backend.enums.AnomalyType;
import com.creditpath.backend.enums.ItemType;

/**
 * Flags items close to the FCRA §605(a) 7-year reporting limit. Bankruptcies
 * follow their own 7/10-year rules and are skipped.
 */
@Component
@Order(40)
public class ApproachingExpirationAnomalyCheck implements AnomalyCheck {

    static final int REPORTING_LIMIT_MONTHS = 84;

    private final ScoreAnalyticsProperties props;

    public ApproachingExpirationAnomalyCheck(ScoreAnalyticsProperties props) {
        this.props = props;
    }

    @Override
    public List<AnomalyAlertDTO> check(AnomalyContext context) {
        if (context.items() == null || context.items().isEmpty()) {
            return List.of();
        }

        LocalDate asOf = context.asOf();
        LocalDate minOpenDate = asOf.minusYears(props.expirationMinAgeYears());

        List<AnomalyAlertDTO> alerts = new ArrayList<>();
        for (NegativeItem item : context.items()) {
            if (item == null || !item.isActive()) continue;
            if (item.getItemType() == ItemType.BANKRUPTCY) continue;
            if (item.getDateOpened() == null || !item.getDateOpened().isBefore(minOpenDate)) continue;

            long ageMonths = ChronoUnit.MONTHS.between(item.getDateOpened(), asOf);
            if (ageMonths < props.expirationWarningMonths()) {
                continue;
            }

            long monthsLeft = Math.max(0, REPORTING_LIMIT_MONTHS - ageMonths);
            String creditor = item.getCreditorName() != null ? item.getCreditorName() : "unknown creditor";
            alerts.add(AnomalyAlertDTO.builder()
                    .type(AnomalyType.APPROACHING_EXPIRATION)
                    .severity(ageMonths >= props.expirationCriticalMonths() ? AlertSeverity.CRITICAL : AlertSeverity.INFO)
                    .bureau(item.getBureau())
                    .creditItemId(item.getId())
                    .message(String.format(
                            "%s item from %s is %d months old, %d month(s) from the 7-year FCRA reporting limit",
                            item.getItemType().getCode(), creditor, ageMonths, monthsLeft))
                    .recommendation("Confirm the date of first delinquency and request deletion under FCRA §605(a) once the 7-year limit passes")
                    .build());
        }
        return alerts;
    }
}
