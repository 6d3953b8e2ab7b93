package com.creditpath.backend.services;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.creditpath.backend.config.ScoreAnalyticsProperties;
import com.creditpath.backend.dto.anomaly.AnomalyReportDTO;
import com.creditpath.backend.dto.projection.ProjectionReportDTO;
import com.creditpath.backend.dto.report.CreditReportDTO;
import com.creditpath.backend.dto.report.ScoreFactorsDTO;
import com.creditpath.backend.dto.score.BureauComparisonDTO;
import com.creditpath.backend.dto.score.TrendResultDTO;
import com.creditpath.backend.entities.DisputeAttempt;
import com.creditpath.backend.entities.NegativeItem;
import com.creditpath.backend.entities.ScoreObservation;
import com.creditpath.backend.enums.Bureau;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads a client's records once and runs every analytics component over the
 * same snapshot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CreditReportService {

    private final ClientRecordsReader clientRecordsReader;
    private final ScoreTrendService scoreTrendService;
    private final BureauComparisonService bureauComparisonService;
    private final AnomalyDetectionService anomalyDetectionService;
    private final ScoreProjectionService scoreProjectionService;
    private final ScoreFactorsService scoreFactorsService;
    private final ScoreAnalyticsProperties properties;
    private final Clock clock;

    public CreditReportDTO generateReport(UUID clientId) {
        LocalDateTime generatedAt = LocalDateTime.now(clock);
        LocalDate asOf = generatedAt.toLocalDate();
        log.info("[CreditReport] Generating report clientId={} asOf={}", clientId, asOf);

        List<ScoreObservation> observations = clientRecordsReader.observations(clientId);
        List<NegativeItem> items = clientRecordsReader.items(clientId);
        List<DisputeAttempt> disputes = clientRecordsReader.disputes(clientId);

        BureauComparisonDTO comparison = bureauComparisonService.compareBureaus(
                bureauComparisonService.latestPerBureau(observations));

        Map<Bureau, TrendResultDTO> trends = new EnumMap<>(Bureau.class);
        for (Bureau bureau : Bureau.values()) {
            List<ScoreObservation> history = observations.stream().filter(o -> o.getBureau() == bureau).toList();
            if (!history.isEmpty()) {
                trends.put(bureau, scoreTrendService.computeTrend(history, properties.trendWindowMonths(), asOf));
            }
        }

        ScoreFactorsDTO factors = scoreFactorsService.analyzeFactors(items, disputes);

        int disputesInWindow = anomalyDetectionService.countDisputesSentInWindow(disputes, asOf);
        AnomalyReportDTO anomalies = anomalyDetectionService.detectAnomalies(observations, items, disputesInWindow, asOf);

        ProjectionReportDTO projection = scoreProjectionService.projectImprovement(projectionBaseline(comparison), items);

        if (anomalies.getCriticalCount() > 0) {
            log.warn("[CreditReport] clientId={} has {} critical anomaly alert(s)", clientId, anomalies.getCriticalCount());
        }

        return CreditReportDTO.builder()
                .clientId(clientId)
                .reportDate(asOf)
                .comparison(comparison)
                .trends(trends)
                .factors(factors)
                .recommendations(scoreFactorsService.recommend(comparison.getAverage(), factors))
                .anomalies(anomalies)
                .projection(projection)
                .generatedAt(generatedAt)
                .build();
    }

    public AnomalyReportDTO detectAnomalies(UUID clientId) {
        LocalDate asOf = LocalDate.now(clock);
        List<DisputeAttempt> disputes = clientRecordsReader.disputes(clientId);
        return anomalyDetectionService.detectAnomalies(
                clientRecordsReader.observations(clientId),
                clientRecordsReader.items(clientId),
                anomalyDetectionService.countDisputesSentInWindow(disputes, asOf),
                asOf);
    }

    public ProjectionReportDTO projectImprovement(UUID clientId) {
        BureauComparisonDTO comparison = bureauComparisonService.compareBureaus(
                bureauComparisonService.latestPerBureau(clientRecordsReader.observations(clientId)));
        return scoreProjectionService.projectImprovement(projectionBaseline(comparison),
                clientRecordsReader.items(clientId));
    }

    public TrendResultDTO calculateTrend(UUID clientId, Bureau bureau, int months) {
        return scoreTrendService.computeTrend(
                clientRecordsReader.observations(clientId, bureau),
                months,
                LocalDate.now(clock));
    }

    /**
     * Bureau average, or the configured default score when the client has no
     * readings yet.
     */
    private int projectionBaseline(BureauComparisonDTO comparison) {
        return comparison.getScores().isEmpty() ? properties.defaultCurrentScore() : comparison.getAverage();
    }
}
