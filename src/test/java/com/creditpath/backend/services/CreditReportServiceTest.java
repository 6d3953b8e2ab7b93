package com.creditpath.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.creditpath.backend.config.ScoreAnalyticsProperties;
import com.creditpath.backend.dto.anomaly.AnomalyReportDTO;
import com.creditpath.backend.dto.projection.ProjectionReportDTO;
import com.creditpath.backend.dto.report.CreditReportDTO;
import com.creditpath.backend.dto.report.RecommendationDTO;
import com.creditpath.backend.dto.score.TrendResultDTO;
import com.creditpath.backend.entities.DisputeAttempt;
import com.creditpath.backend.entities.NegativeItem;
import com.creditpath.backend.entities.ScoreObservation;
import com.creditpath.backend.enums.AnomalyType;
import com.creditpath.backend.enums.Bureau;
import com.creditpath.backend.enums.DisputeStatus;
import com.creditpath.backend.enums.ItemStatus;
import com.creditpath.backend.enums.ItemType;
import com.creditpath.backend.enums.TrendDirection;
import com.creditpath.backend.repositories.DisputeHistoryRepository;
import com.creditpath.backend.repositories.ScoreRecordRepository;
import com.creditpath.backend.services.anomalies.ApproachingExpirationAnomalyCheck;
import com.creditpath.backend.services.anomalies.BureauInconsistencyAnomalyCheck;
import com.creditpath.backend.services.anomalies.StagnationAnomalyCheck;
import com.creditpath.backend.services.anomalies.SuddenDropAnomalyCheck;
import com.creditpath.backend.services.strategy.ItemTypeStrategyCatalog;
import com.creditpath.backend.services.strategy.ScoreImpactEstimator;

@ExtendWith(MockitoExtension.class)
class CreditReportServiceTest {

    private static final UUID CLIENT = UUID.randomUUID();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-06-30T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private ScoreRecordRepository scoreRecordRepository;

    @Mock
    private DisputeHistoryRepository disputeHistoryRepository;

    private CreditReportService service;

    @BeforeEach
    void setUp() {
        ScoreAnalyticsProperties props = ScoreAnalyticsProperties.defaults();
        AnomalyDetectionService anomalies = new AnomalyDetectionService(List.of(
                new SuddenDropAnomalyCheck(props),
                new BureauInconsistencyAnomalyCheck(props),
                new StagnationAnomalyCheck(props),
                new ApproachingExpirationAnomalyCheck(props)), props);

        service = new CreditReportService(
                ClientRecordsReaderTest.recordsReader(scoreRecordRepository, disputeHistoryRepository),
                new ScoreTrendService(props),
                new BureauComparisonService(),
                anomalies,
                new ScoreProjectionService(new ScoreImpactEstimator(new ItemTypeStrategyCatalog())),
                new ScoreFactorsService(),
                props,
                CLOCK);
    }

    @Test
    void generateReportCombinesEveryComponent() {
        when(scoreRecordRepository.findByClientIdOrderByObservedDateAsc(CLIENT)).thenReturn(history());
        when(scoreRecordRepository.findItemsByClientId(CLIENT)).thenReturn(List.of(collection()));
        when(disputeHistoryRepository.findByClientId(CLIENT)).thenReturn(List.of(DisputeAttempt.builder()
                .id(UUID.randomUUID())
                .clientId(CLIENT)
                .status(DisputeStatus.SENT)
                .sentDate(LocalDate.of(2026, 5, 15))
                .build()));

        CreditReportDTO report = service.generateReport(CLIENT);

        assertEquals(LocalDate.of(2026, 6, 30), report.getReportDate());
        assertEquals(LocalDateTime.of(2026, 6, 30, 12, 0), report.getGeneratedAt());

        assertEquals(675, report.getComparison().getAverage());
        assertEquals(50, report.getComparison().getSpread());

        assertEquals(TrendDirection.IMPROVING, report.getTrends().get(Bureau.EQUIFAX).getTrend());
        assertEquals(TrendDirection.INSUFFICIENT_DATA, report.getTrends().get(Bureau.EXPERIAN).getTrend());
        assertFalse(report.getTrends().containsKey(Bureau.TRANSUNION));

        assertEquals(1, report.getAnomalies().getTotalAlerts());
        assertEquals(AnomalyType.BUREAU_INCONSISTENCY, report.getAnomalies().getAlerts().get(0).getType());

        assertEquals(775, report.getProjection().getProjectedScore());
        assertEquals(1, report.getFactors().getTotalDisputes());
        assertEquals(List.of("Resolve collections", "Monitor progress"),
                report.getRecommendations().stream().map(RecommendationDTO::getAction).toList());
    }

    @Test
    void emptyClientProducesEmptyReport() {
        when(scoreRecordRepository.findByClientIdOrderByObservedDateAsc(CLIENT)).thenReturn(null);
        when(scoreRecordRepository.findItemsByClientId(CLIENT)).thenReturn(List.of());
        when(disputeHistoryRepository.findByClientId(CLIENT)).thenReturn(List.of());

        CreditReportDTO report = service.generateReport(CLIENT);

        assertEquals(0, report.getComparison().getAverage());
        assertNull(report.getComparison().getInterpretation());
        assertTrue(report.getTrends().isEmpty());
        assertFalse(report.getAnomalies().isHasAnomalies());
        assertEquals(600, report.getProjection().getCurrentScore());
        assertEquals(600, report.getProjection().getProjectedScore());
    }

    @Test
    void itemsWithoutScoresProjectFromDefaultScore() {
        when(scoreRecordRepository.findByClientIdOrderByObservedDateAsc(CLIENT)).thenReturn(List.of());
        when(scoreRecordRepository.findItemsByClientId(CLIENT)).thenReturn(List.of(collection()));

        ProjectionReportDTO projection = service.projectImprovement(CLIENT);

        assertEquals(600, projection.getCurrentScore());
        assertEquals(710, projection.getProjectedScore());
        assertEquals(765, projection.getBestCaseScore());
        assertEquals(655, projection.getConservativeScore());
        assertTrue(projection.getBestCaseScore() >= projection.getProjectedScore());
        assertTrue(projection.getConservativeScore() >= projection.getCurrentScore());
    }

    @Test
    void detectAnomaliesUsesClockDate() {
        when(scoreRecordRepository.findByClientIdOrderByObservedDateAsc(CLIENT)).thenReturn(history());
        when(scoreRecordRepository.findItemsByClientId(CLIENT)).thenReturn(List.of());
        when(disputeHistoryRepository.findByClientId(CLIENT)).thenReturn(List.of());

        AnomalyReportDTO report = service.detectAnomalies(CLIENT);

        assertEquals(LocalDate.of(2026, 6, 30), report.getAsOf());
        assertEquals(LocalDate.of(2026, 4, 1), report.getWindowStart());
    }

    @Test
    void projectImprovementUsesBureauAverage() {
        when(scoreRecordRepository.findByClientIdOrderByObservedDateAsc(CLIENT)).thenReturn(history());
        when(scoreRecordRepository.findItemsByClientId(CLIENT)).thenReturn(List.of(collection()));

        ProjectionReportDTO projection = service.projectImprovement(CLIENT);

        assertEquals(675, projection.getCurrentScore());
        assertEquals(1, projection.getActiveItems());
    }

    @Test
    void calculateTrendReadsOneBureau() {
        when(scoreRecordRepository.findByClientIdAndBureauOrderByObservedDateAsc(CLIENT, Bureau.EQUIFAX))
                .thenReturn(history().subList(0, 2));

        TrendResultDTO trend = service.calculateTrend(CLIENT, Bureau.EQUIFAX, 6);

        assertEquals(TrendDirection.IMPROVING, trend.getTrend());
        assertEquals(50, trend.getChange());
    }

    private static List<ScoreObservation> history() {
        return List.of(
                obs(Bureau.EQUIFAX, 600, "2025-12-01"),
                obs(Bureau.EQUIFAX, 650, "2026-06-01"),
                obs(Bureau.EXPERIAN, 700, "2026-06-10"));
    }

    private static NegativeItem collection() {
        return NegativeItem.builder()
                .id(UUID.randomUUID())
                .clientId(CLIENT)
                .itemType(ItemType.COLLECTION)
                .status(ItemStatus.IDENTIFIED)
                .build();
    }

    private static ScoreObservation obs(Bureau bureau, int score, String date) {
        return ScoreObservation.builder()
                .clientId(CLIENT)
                .bureau(bureau)
                .score(score)
                .observedDate(LocalDate.parse(date))
                .build();
    }
}
