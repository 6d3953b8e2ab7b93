package com.creditpath.backend.dto.projection;

import com.creditpath.backend.enums.EstimateConfidence;
import com.creditpath.backend.enums.ItemType;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ScoreImprovementEstimateDTO {
    private ItemType itemType;
    private int estimatedMin;
    private int estimatedMax;
    private int projectedScoreMin;
    private int projectedScoreMax;
    private double multiplier;
    private EstimateConfidence confidence;
}
