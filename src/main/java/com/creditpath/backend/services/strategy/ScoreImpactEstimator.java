package com.creditpath.backend.services.strategy;

import org.springframework.stereotype.Component;

import com.creditpath.backend.dto.projection.ScoreImprovementEstimateDTO;
import com.creditpath.backend.entities.ScoreObservation;
import com.creditpath.backend.enums.EstimateConfidence;
import com.creditpath.backend.enums.ItemType;

import lombok.RequiredArgsConstructor;

/**
 * Expected score recovery when one negative item is removed. Lower scores
 * recover more per item; the more items on file, the less any single removal
 * moves the score.
 */
@Component
@RequiredArgsConstructor
public class ScoreImpactEstimator {

    private final ItemTypeStrategyCatalog itemTypeStrategyCatalog;

    public ScoreImprovementEstimateDTO estimate(ItemType itemType, int currentScore, int totalNegativeItems) {
        ScoreImpactRange base = itemTypeStrategyCatalog.forType(itemType).getEstimatedScoreImpact();

        double multiplier = bandMultiplier(currentScore);
        multiplier *= dilutionMultiplier(totalNegativeItems);

        int estimatedMin = (int) Math.round(base.getMin() * multiplier);
        int estimatedMax = (int) Math.round(base.getMax() * multiplier);

        return ScoreImprovementEstimateDTO.builder()
                .itemType(itemType != null ? itemType : ItemType.OTHER)
                .estimatedMin(estimatedMin)
                .estimatedMax(estimatedMax)
                .projectedScoreMin(ScoreObservation.clamp(currentScore + estimatedMin))
                .projectedScoreMax(ScoreObservation.clamp(currentScore + estimatedMax))
                .multiplier(multiplier)
                .confidence(EstimateConfidence.forItemCount(totalNegativeItems))
                .build();
    }

    static double bandMultiplier(int currentScore) {
        if (currentScore < 580) return 1.3;
        if (currentScore < 650) return 1.1;
        if (currentScore >= 740) return 0.7;
        return 1.0;
    }

    static double dilutionMultiplier(int totalNegativeItems) {
        if (totalNegativeItems > 10) return 0.7;
        if (totalNegativeItems > 5) return 0.85;
        return 1.0;
    }
}
