package com.creditpath.backend.dto.score;

import com.creditpath.backend.enums.ScoreBand;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ScoreInterpretationDTO {
    private String range;
    private String description;

    public static ScoreInterpretationDTO of(int score) {
        ScoreBand band = ScoreBand.of(score);
        return ScoreInterpretationDTO.builder()
                .range(band.getDisplayName())
                .description(band.getDescription())
                .build();
    }
}
