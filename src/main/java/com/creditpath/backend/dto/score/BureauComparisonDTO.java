package com.creditpath.backend.dto.score;

import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Latest score per bureau with aggregate figures. When no bureau has reported,
 * every figure is zero and {@code interpretation} is null.
 */
@Data
@Builder
public class BureauComparisonDTO {
    private List<BureauScoreDTO> scores;
    private int average;
    private int highest;
    private int lowest;
    private int spread;
    private ScoreInterpretationDTO interpretation;
}
