package com.creditpath.backend.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.springframework.stereotype.Service;

import com.creditpath.backend.config.ScoreAnalyticsProperties;
import com.creditpath.backend.dto.score.ScoreChangeDTO;
import com.creditpath.backend.dto.score.TrendResultDTO;
import com.creditpath.backend.entities.ScoreObservation;
import com.creditpath.backend.enums.ScoreMovement;
import com.creditpath.backend.enums.TrendDirection;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class ScoreTrendService {

    private final ScoreAnalyticsProperties properties;

    /**
     * Direction of one bureau's score over the lookback window: the latest
     * observation against the last one recorded at or before {@code asOf - windowMonths}.
     *
     * @param observations one bureau's history, any order
     * @param windowMonths lookback in months; non-positive uses the configured default
     * @param asOf reference date; later observations are ignored
     */
    public TrendResultDTO computeTrend(List<ScoreObservation> observations, int windowMonths, LocalDate asOf) {
        int months = windowMonths > 0 ? windowMonths : properties.trendWindowMonths();
        List<ScoreObservation> history = upTo(observations, asOf);

        if (history.isEmpty()) {
            return TrendResultDTO.builder()
                    .trend(TrendDirection.INSUFFICIENT_DATA)
                    .dataPoints(0)
                    .periodMonths(months)
                    .build();
        }

        LocalDate boundary = asOf.minusMonths(months);
        ScoreObservation current = history.get(history.size() - 1);

        int pastIndex = -1;
        for (int i = 0; i < history.size(); i++) {
            if (!history.get(i).getObservedDate().isAfter(boundary)) {
                pastIndex = i;
            }
        }

        // The boundary reading must be a different observation than the current one.
        if (pastIndex < 0 || pastIndex == history.size() - 1) {
            int inWindow = (int) history.stream().filter(o -> o.getObservedDate().isAfter(boundary)).count();
            return TrendResultDTO.builder()
                    .bureau(current.getBureau())
                    .trend(TrendDirection.INSUFFICIENT_DATA)
                    .currentScore(current.getScore())
                    .dataPoints(inWindow)
                    .periodMonths(months)
                    .build();
        }

        ScoreObservation past = history.get(pastIndex);
        int change = current.getScore() - past.getScore();
        BigDecimal percentChange = BigDecimal.valueOf(change)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(past.getScore()), 2, RoundingMode.HALF_UP);

        return TrendResultDTO.builder()
                .bureau(current.getBureau())
                .trend(change > 0 ? TrendDirection.IMPROVING : change < 0 ? TrendDirection.DECLINING : TrendDirection.STABLE)
                .currentScore(current.getScore())
                .pastScore(past.getScore())
                .change(change)
                .percentChange(percentChange)
                .dataPoints(history.size() - pastIndex)
                .periodMonths(months)
                .build();
    }

    /**
     * Movement of a newly recorded score against the bureau's previous one.
     * A first reading is NEW; an unchanged score counts as UP.
     */
    public ScoreChangeDTO describeChange(ScoreObservation previous, ScoreObservation current) {
        Objects.requireNonNull(current, "current");
        Integer previousScore = previous != null ? previous.getScore() : null;
        int change = previousScore != null ? current.getScore() - previousScore : 0;

        ScoreMovement movement;
        if (previousScore == null) {
            movement = ScoreMovement.NEW;
        } else {
            movement = current.getScore() >= previousScore ? ScoreMovement.UP : ScoreMovement.DOWN;
        }

        return ScoreChangeDTO.builder()
                .bureau(current.getBureau())
                .score(current.getScore())
                .observedDate(current.getObservedDate())
                .previousScore(previousScore)
                .change(change)
                .movement(movement)
                .build();
    }

    /**
     * Newest first, at most {@code limit} entries (configured default when non-positive).
     */
    public List<ScoreObservation> recentHistory(List<ScoreObservation> observations, int limit) {
        int max = limit > 0 ? limit : properties.historyLimit();
        if (observations == null || observations.isEmpty()) {
            return List.of();
        }
        return observations.stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(ScoreObservation::getObservedDate).reversed())
                .limit(max)
                .toList();
    }

    private static List<ScoreObservation> upTo(List<ScoreObservation> observations, LocalDate asOf) {
        if (observations == null || observations.isEmpty()) {
            return List.of();
        }
        List<ScoreObservation> out = new ArrayList<>();
        for (ScoreObservation o : observations) {
            if (o == null || o.getObservedDate().isAfter(asOf)) {
                continue;
            }
            out.add(o);
        }
        out.sort(Comparator.comparing(ScoreObservation::getObservedDate));
        return out;
    }
}
