package com.creditpath.backend.services;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.creditpath.backend.config.ScoreAnalyticsProperties;
import com.creditpath.backend.dto.anomaly.AnomalyAlertDTO;
import com.creditpath.backend.dto.anomaly.AnomalyReportDTO;
import com.creditpath.backend.entities.DisputeAttempt;
import com.creditpath.backend.entities.NegativeItem;
import com.creditpath.backend.entities.ScoreObservation;
import com.creditpath.backend.enums.AlertSeverity;
import com.creditpath.backend.enums.Bureau;
import com.creditpath.backend.services.anomalies.AnomalyCheck;
import com.creditpath.backend.services.anomalies.AnomalyContext;

@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final List<AnomalyCheck> checks;
    private final ScoreAnalyticsProperties props;

    public AnomalyDetectionService(List<AnomalyCheck> checks, ScoreAnalyticsProperties props) {
        this.checks = checks;
        this.props = props;
    }

    /**
     * Runs every check over the anomaly window ending at {@code asOf} and
     * concatenates their alerts in check order.
     *
     * @param observations client history across bureaus, any order
     * @param items the client's negative items
     * @param disputesSentInWindow disputes mailed during the window
     * @param asOf reference date
     */
    public AnomalyReportDTO detectAnomalies(
            List<ScoreObservation> observations,
            List<NegativeItem> items,
            int disputesSentInWindow,
            LocalDate asOf
    ) {
        LocalDate windowStart = windowStart(asOf);

        List<ScoreObservation> inWindow = new ArrayList<>();
        if (observations != null) {
            for (ScoreObservation o : observations) {
                if (o == null) continue;
                if (o.getObservedDate().isBefore(windowStart) || o.getObservedDate().isAfter(asOf)) continue;
                inWindow.add(o);
            }
        }
        inWindow.sort(Comparator.comparing(ScoreObservation::getObservedDate));

        Map<Bureau, List<ScoreObservation>> byBureau = new EnumMap<>(Bureau.class);
        for (ScoreObservation o : inWindow) {
            byBureau.computeIfAbsent(o.getBureau(), b -> new ArrayList<>()).add(o);
        }

        AnomalyContext context = new AnomalyContext(
                List.copyOf(inWindow),
                byBureau,
                items != null ? items : List.of(),
                Math.max(0, disputesSentInWindow),
                windowStart,
                asOf);

        List<AnomalyAlertDTO> alerts = new ArrayList<>();
        for (AnomalyCheck check : checks) {
            List<AnomalyAlertDTO> found = check.check(context);
            if (found != null && !found.isEmpty()) {
                log.debug("[Anomalies] {} raised {} alert(s)", check.getClass().getSimpleName(), found.size());
                alerts.addAll(found);
            }
        }

        return AnomalyReportDTO.builder()
                .alerts(alerts)
                .totalAlerts(alerts.size())
                .criticalCount(count(alerts, AlertSeverity.CRITICAL))
                .warningCount(count(alerts, AlertSeverity.WARNING))
                .infoCount(count(alerts, AlertSeverity.INFO))
                .windowStart(windowStart)
                .asOf(asOf)
                .build();
    }

    /**
     * Disputes that left the office (status past draft) within the window ending at {@code asOf}.
     */
    public int countDisputesSentInWindow(List<DisputeAttempt> attempts, LocalDate asOf) {
        if (attempts == null || attempts.isEmpty()) {
            return 0;
        }
        LocalDate windowStart = windowStart(asOf);
        return (int) attempts.stream()
                .filter(Objects::nonNull)
                .filter(a -> a.getStatus() != null && a.getStatus().isSent())
                .map(DisputeAttempt::effectiveDate)
                .filter(Objects::nonNull)
                .filter(d -> !d.isBefore(windowStart) && !d.isAfter(asOf))
                .count();
    }

    private LocalDate windowStart(LocalDate asOf) {
        return asOf.minusDays(props.anomalyWindowDays());
    }

    private static int count(List<AnomalyAlertDTO> alerts, AlertSeverity severity) {
        return (int) alerts.stream().filter(a -> a.getSeverity() == severity).count();
    }
}
