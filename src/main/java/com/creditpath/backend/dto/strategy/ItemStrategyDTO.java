package com.creditpath.backend.dto.strategy;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import com.creditpath.backend.dto.projection.ScoreImprovementEstimateDTO;
import com.creditpath.backend.enums.Bureau;
import com.creditpath.backend.enums.ItemType;
import com.creditpath.backend.enums.PreviousResult;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ItemStrategyDTO {
    private UUID creditItemId;
    private ItemType itemType;
    private String creditorName;
    private BigDecimal balance;
    private Bureau bureau;
    private StrategyRecommendationDTO strategy;
    private int currentRound;
    private PreviousResult previousResult;
    private ScoreImprovementEstimateDTO scoreImpact;
    private List<RoundDTO> allRounds;
}
