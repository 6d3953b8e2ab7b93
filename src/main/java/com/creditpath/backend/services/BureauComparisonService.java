package com.creditpath.backend.services;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.creditpath.backend.dto.score.BureauComparisonDTO;
import com.creditpath.backend.dto.score.BureauScoreDTO;
import com.creditpath.backend.dto.score.ScoreInterpretationDTO;
import com.creditpath.backend.entities.ScoreObservation;
import com.creditpath.backend.enums.Bureau;

@Service
public class BureauComparisonService {

    /**
     * Latest observation per bureau. On equal dates the later entry in the input wins.
     */
    public List<ScoreObservation> latestPerBureau(List<ScoreObservation> observations) {
        if (observations == null || observations.isEmpty()) {
            return List.of();
        }
        Map<Bureau, ScoreObservation> latest = new EnumMap<>(Bureau.class);
        for (ScoreObservation o : observations) {
            if (o == null) continue;
            ScoreObservation existing = latest.get(o.getBureau());
            if (existing == null || !o.getObservedDate().isBefore(existing.getObservedDate())) {
                latest.put(o.getBureau(), o);
            }
        }
        return new ArrayList<>(latest.values());
    }

    /**
     * Spread and average across the bureaus' latest scores. Duplicate bureaus in
     * the input are collapsed to their latest entry first.
     */
    public BureauComparisonDTO compareBureaus(List<ScoreObservation> latestObservationsPerBureau) {
        List<ScoreObservation> latest = latestPerBureau(latestObservationsPerBureau);

        if (latest.isEmpty()) {
            return BureauComparisonDTO.builder()
                    .scores(List.of())
                    .average(0)
                    .highest(0)
                    .lowest(0)
                    .spread(0)
                    .build();
        }

        int sum = 0;
        int highest = Integer.MIN_VALUE;
        int lowest = Integer.MAX_VALUE;
        for (ScoreObservation o : latest) {
            sum += o.getScore();
            highest = Math.max(highest, o.getScore());
            lowest = Math.min(lowest, o.getScore());
        }
        int average = (int) Math.round((double) sum / latest.size());

        return BureauComparisonDTO.builder()
                .scores(latest.stream().map(BureauScoreDTO::from).toList())
                .average(average)
                .highest(highest)
                .lowest(lowest)
                .spread(highest - lowest)
                .interpretation(ScoreInterpretationDTO.of(average))
                .build();
    }
}
