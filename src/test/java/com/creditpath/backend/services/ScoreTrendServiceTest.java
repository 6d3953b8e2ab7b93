package com.creditpath.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.creditpath.backend.config.ScoreAnalyticsProperties;
import com.creditpath.backend.dto.score.ScoreChangeDTO;
import com.creditpath.backend.dto.score.TrendResultDTO;
import com.creditpath.backend.entities.ScoreObservation;
import com.creditpath.backend.enums.Bureau;
import com.creditpath.backend.enums.ScoreMovement;
import com.creditpath.backend.enums.TrendDirection;

class ScoreTrendServiceTest {

    private static final UUID CLIENT = UUID.randomUUID();
    private static final LocalDate AS_OF = LocalDate.of(2026, 6, 30);

    private final ScoreTrendService service = new ScoreTrendService(ScoreAnalyticsProperties.defaults());

    @Test
    @DisplayName("No history or a single reading is insufficient data")
    void zeroOrOnePointIsInsufficient() {
        TrendResultDTO empty = service.computeTrend(List.of(), 6, AS_OF);
        assertEquals(TrendDirection.INSUFFICIENT_DATA, empty.getTrend());
        assertEquals(0, empty.getDataPoints());
        assertNull(empty.getCurrentScore());

        TrendResultDTO single = service.computeTrend(List.of(obs(680, "2026-06-01")), 6, AS_OF);
        assertEquals(TrendDirection.INSUFFICIENT_DATA, single.getTrend());
        assertEquals(680, single.getCurrentScore());
        assertEquals(1, single.getDataPoints());

        TrendResultDTO oldSingle = service.computeTrend(List.of(obs(680, "2025-01-01")), 6, AS_OF);
        assertEquals(TrendDirection.INSUFFICIENT_DATA, oldSingle.getTrend());
    }

    @Test
    void readingsOnlyInsideTheWindowHaveNoBaseline() {
        TrendResultDTO result = service.computeTrend(
                List.of(obs(640, "2026-02-01"), obs(700, "2026-06-01")), 6, AS_OF);

        assertEquals(TrendDirection.INSUFFICIENT_DATA, result.getTrend());
        assertEquals(700, result.getCurrentScore());
        assertEquals(2, result.getDataPoints());
        assertNull(result.getPastScore());
    }

    @Test
    void improvingAgainstTheBoundaryReading() {
        TrendResultDTO result = service.computeTrend(
                List.of(obs(590, "2025-09-01"), obs(600, "2025-12-01"), obs(630, "2026-03-01"), obs(650, "2026-06-01")),
                6, AS_OF);

        assertEquals(TrendDirection.IMPROVING, result.getTrend());
        assertEquals(650, result.getCurrentScore());
        assertEquals(600, result.getPastScore());
        assertEquals(50, result.getChange());
        assertEquals(new BigDecimal("8.33"), result.getPercentChange());
        assertEquals(3, result.getDataPoints());
        assertEquals("6 months", result.getPeriod());
        assertEquals(Bureau.EQUIFAX, result.getBureau());
    }

    @Test
    void decliningAndStable() {
        TrendResultDTO declining = service.computeTrend(
                List.of(obs(650, "2025-11-15"), obs(600, "2026-06-20")), 6, AS_OF);
        assertEquals(TrendDirection.DECLINING, declining.getTrend());
        assertEquals(-50, declining.getChange());
        assertEquals(new BigDecimal("-7.69"), declining.getPercentChange());

        TrendResultDTO stable = service.computeTrend(
                List.of(obs(700, "2025-11-15"), obs(700, "2026-06-20")), 6, AS_OF);
        assertEquals(TrendDirection.STABLE, stable.getTrend());
        assertEquals(0, stable.getChange());
        assertEquals(new BigDecimal("0.00"), stable.getPercentChange());
    }

    @Test
    void readingsAfterTheReferenceDateAreIgnoredAndOrderDoesNotMatter() {
        TrendResultDTO result = service.computeTrend(
                List.of(obs(720, "2026-07-15"), obs(660, "2026-06-01"), obs(640, "2025-10-01")), 6, AS_OF);

        assertEquals(TrendDirection.IMPROVING, result.getTrend());
        assertEquals(660, result.getCurrentScore());
        assertEquals(640, result.getPastScore());
    }

    @Test
    void nonPositiveWindowUsesConfiguredDefault() {
        TrendResultDTO result = service.computeTrend(
                List.of(obs(600, "2025-12-01"), obs(650, "2026-06-01")), 0, AS_OF);

        assertEquals(6, result.getPeriodMonths());
        assertEquals(TrendDirection.IMPROVING, result.getTrend());
    }

    @Test
    void describeChangeClassifiesMovement() {
        ScoreChangeDTO first = service.describeChange(null, obs(640, "2026-01-01"));
        assertEquals(ScoreMovement.NEW, first.getMovement());
        assertEquals(0, first.getChange());
        assertNull(first.getPreviousScore());

        ScoreChangeDTO down = service.describeChange(obs(640, "2026-01-01"), obs(610, "2026-02-01"));
        assertEquals(ScoreMovement.DOWN, down.getMovement());
        assertEquals(-30, down.getChange());

        ScoreChangeDTO same = service.describeChange(obs(640, "2026-01-01"), obs(640, "2026-02-01"));
        assertEquals(ScoreMovement.UP, same.getMovement());
    }

    @Test
    void recentHistoryIsNewestFirstAndLimited() {
        List<ScoreObservation> history = List.of(
                obs(600, "2026-01-01"), obs(610, "2026-02-01"), obs(620, "2026-03-01"));

        List<ScoreObservation> recent = service.recentHistory(history, 2);

        assertEquals(2, recent.size());
        assertEquals(620, recent.get(0).getScore());
        assertEquals(610, recent.get(1).getScore());
        assertEquals(3, service.recentHistory(history, 0).size());
    }

    private static ScoreObservation obs(int score, String date) {
        return ScoreObservation.builder()
                .clientId(CLIENT)
                .bureau(Bureau.EQUIFAX)
                .score(score)
                .observedDate(LocalDate.parse(date))
                .build();
    }
}
