package com.creditpath.backend.dto.score;

import java.time.LocalDate;

import com.creditpath.backend.entities.ScoreObservation;
import com.creditpath.backend.enums.Bureau;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class BureauScoreDTO {
    private Bureau bureau;
    private int score;
    private LocalDate observedDate;

    public static BureauScoreDTO from(ScoreObservation observation) {
        return BureauScoreDTO.builder()
                .bureau(observation.getBureau())
                .score(observation.getScore())
                .observedDate(observation.getObservedDate())
                .build();
    }
}
