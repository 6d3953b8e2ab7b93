package com.creditpath.backend.dto.strategy;

import java.util.List;

import com.creditpath.backend.enums.DisputeType;
import com.creditpath.backend.enums.ItemType;
import com.creditpath.backend.services.strategy.ScoreImpactRange;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ItemTypeSummaryDTO {
    private ItemType value;
    private String name;
    private DisputeType primaryStrategy;
    private ScoreImpactRange estimatedScoreImpact;
    private List<String> tips;
    private List<String> legalArguments;
}
