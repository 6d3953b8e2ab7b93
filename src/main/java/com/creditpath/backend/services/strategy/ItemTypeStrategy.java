package com.creditpath.backend.services.strategy;

import java.util.List;

import com.creditpath.backend.enums.DisputeType;
import com.creditpath.backend.enums.ItemType;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class ItemTypeStrategy {
    ItemType itemType;
    String name;
    DisputeType primaryStrategy;
    @Singular("alternativeStrategy")
    List<DisputeType> alternativeStrategies;
    ScoreImpactRange estimatedScoreImpact;
    @Singular("tip")
    List<String> tips;
    @Singular("legalArgument")
    List<String> legalArguments;

    public DisputeType firstAlternativeOrPrimary() {
        return alternativeStrategies.isEmpty() ? primaryStrategy : alternativeStrategies.get(0);
    }
}
