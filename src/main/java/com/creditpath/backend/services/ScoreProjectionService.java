package com.creditpath.backend.services;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.springframework.stereotype.Service;

import com.creditpath.backend.dto.projection.ItemImpactDTO;
import com.creditpath.backend.dto.projection.ProjectionReportDTO;
import com.creditpath.backend.dto.projection.ScoreImprovementEstimateDTO;
import com.creditpath.backend.dto.projection.TimelineStepDTO;
import com.creditpath.backend.dto.score.ScoreInterpretationDTO;
import com.creditpath.backend.entities.NegativeItem;
import com.creditpath.backend.entities.ScoreObservation;
import com.creditpath.backend.enums.Priority;
import com.creditpath.backend.services.strategy.ScoreImpactEstimator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScoreProjectionService {

    private static final int TOP_PRIORITY_ITEMS = 3;

    private final ScoreImpactEstimator scoreImpactEstimator;

    /**
     * Projects the score gained by resolving the client's negative items, biggest
     * expected gain first. The current average is clamped to the 300-850 scale
     * and every figure is projected from that one baseline.
     *
     * @param currentAverage average of the latest per-bureau scores
     * @param activeItems the client's items; deleted ones are skipped
     */
    public ProjectionReportDTO projectImprovement(int currentAverage, List<NegativeItem> activeItems) {
        List<NegativeItem> items = activeItems == null ? List.of() : activeItems.stream()
                .filter(Objects::nonNull)
                .filter(NegativeItem::isActive)
                .toList();
        int itemCount = items.size();
        int baseline = ScoreObservation.clamp(currentAverage);

        List<ItemImpactDTO> impacts = new ArrayList<>(itemCount);
        for (NegativeItem item : items) {
            ScoreImprovementEstimateDTO estimate = scoreImpactEstimator.estimate(item.getItemType(), baseline, itemCount);
            impacts.add(ItemImpactDTO.builder()
                    .creditItemId(item.getId())
                    .itemType(item.getItemType())
                    .creditorName(item.getCreditorName())
                    .bureau(item.getBureau())
                    .estimatedMin(estimate.getEstimatedMin())
                    .estimatedMax(estimate.getEstimatedMax())
                    .priority(priorityFor(estimate.getEstimatedMax()))
                    .build());
        }
        impacts.sort(Comparator.comparingInt(ItemImpactDTO::getEstimatedMax).reversed());

        List<TimelineStepDTO> timeline = new ArrayList<>(itemCount);
        int running = baseline;
        int totalMin = 0;
        int totalMax = 0;
        for (int i = 0; i < impacts.size(); i++) {
            ItemImpactDTO impact = impacts.get(i);
            running = ScoreObservation.clamp(running + impact.getAverageGain());
            totalMin += impact.getEstimatedMin();
            totalMax += impact.getEstimatedMax();
            timeline.add(TimelineStepDTO.builder()
                    .step(i + 1)
                    .creditItemId(impact.getCreditItemId())
                    .itemType(impact.getItemType())
                    .creditorName(impact.getCreditorName())
                    .expectedGain(impact.getAverageGain())
                    .projectedScore(running)
                    .build());
        }

        int bestCase = ScoreObservation.clamp(baseline + totalMax);
        int conservative = ScoreObservation.clamp(baseline + totalMin);

        log.debug("[Projection] current={} items={} projected={} bestCase={} conservative={}",
                baseline, itemCount, running, bestCase, conservative);

        return ProjectionReportDTO.builder()
                .currentScore(baseline)
                .currentCategory(ScoreInterpretationDTO.of(baseline))
                .activeItems(itemCount)
                .itemImpacts(impacts)
                .timeline(timeline)
                .projectedScore(running)
                .projectedCategory(ScoreInterpretationDTO.of(running))
                .bestCaseScore(bestCase)
                .conservativeScore(conservative)
                .topPriorityItems(List.copyOf(impacts.subList(0, Math.min(TOP_PRIORITY_ITEMS, impacts.size()))))
                .build();
    }

    static Priority priorityFor(int estimatedMax) {
        if (estimatedMax > 80) return Priority.CRITICAL;
        if (estimatedMax > 40) return Priority.HIGH;
        return Priority.MEDIUM;
    }
}
