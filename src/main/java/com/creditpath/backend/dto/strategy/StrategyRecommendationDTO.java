package com.creditpath.backend.dto.strategy;

import java.util.List;

import com.creditpath.backend.enums.DisputeType;
import com.creditpath.backend.enums.ItemType;
import com.creditpath.backend.enums.PreviousResult;
import com.creditpath.backend.services.strategy.BureauProfile;
import com.creditpath.backend.services.strategy.ScoreImpactRange;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class StrategyRecommendationDTO {
    private ItemType itemType;
    private String itemTypeName;
    private DisputeType recommendedDisputeType;
    private List<DisputeType> alternativeStrategies;
    private RoundDTO round;
    private PreviousResult previousResult;
    private ScoreImpactRange estimatedScoreImpact;
    private List<String> tips;
    private List<String> legalArguments;
    private BureauProfile bureauStrategy; // null when the bureau is unknown
}
