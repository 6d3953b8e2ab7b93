package com.creditpath.backend.dto.projection;

import java.util.List;

import com.creditpath.backend.dto.score.ScoreInterpretationDTO;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ProjectionReportDTO {
    private int currentScore;
    private ScoreInterpretationDTO currentCategory;
    private int activeItems;
    private List<ItemImpactDTO> itemImpacts;
    private List<TimelineStepDTO> timeline;
    private int projectedScore;
    private ScoreInterpretationDTO projectedCategory;
    private int bestCaseScore;
    private int conservativeScore;
    private List<ItemImpactDTO> topPriorityItems;
}
