package com.creditpath.backend.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.springframework.stereotype.Service;

import com.creditpath.backend.dto.report.ItemFactorDTO;
import com.creditpath.backend.dto.report.RecommendationDTO;
import com.creditpath.backend.dto.report.ScoreFactorsDTO;
import com.creditpath.backend.entities.DisputeAttempt;
import com.creditpath.backend.entities.NegativeItem;
import com.creditpath.backend.enums.DisputeStatus;
import com.creditpath.backend.enums.ItemStatus;
import com.creditpath.backend.enums.ItemType;
import com.creditpath.backend.enums.Priority;

@Service
public class ScoreFactorsService {

    private static final int DISPUTE_SCORE_THRESHOLD = 650;

    public ScoreFactorsDTO analyzeFactors(List<NegativeItem> items, List<DisputeAttempt> disputes) {
        List<NegativeItem> safeItems = items == null ? List.of() : items.stream().filter(Objects::nonNull).toList();
        List<DisputeAttempt> safeDisputes = disputes == null ? List.of() : disputes.stream().filter(Objects::nonNull).toList();

        Map<FactorKey, Long> counts = new TreeMap<>(FactorKey.ORDER);
        for (NegativeItem item : safeItems) {
            ItemStatus status = item.getStatus() != null ? item.getStatus() : ItemStatus.IDENTIFIED;
            counts.merge(new FactorKey(item.getItemType(), status), 1L, Long::sum);
        }

        List<ItemFactorDTO> factors = new ArrayList<>(counts.size());
        counts.forEach((key, count) -> factors.add(ItemFactorDTO.builder()
                .itemType(key.itemType())
                .status(key.status())
                .count(count)
                .resolvedCount(key.status() == ItemStatus.DELETED ? count : 0)
                .build()));

        Map<DisputeStatus, Long> disputesByStatus = new EnumMap<>(DisputeStatus.class);
        for (DisputeAttempt d : safeDisputes) {
            if (d.getStatus() != null) {
                disputesByStatus.merge(d.getStatus(), 1L, Long::sum);
            }
        }

        long totalDisputes = safeDisputes.size();
        long resolvedDisputes = disputesByStatus.getOrDefault(DisputeStatus.RESOLVED, 0L);
        BigDecimal successRate = totalDisputes == 0
                ? BigDecimal.ZERO.setScale(1)
                : BigDecimal.valueOf(resolvedDisputes * 100)
                        .divide(BigDecimal.valueOf(totalDisputes), 1, RoundingMode.HALF_UP);

        return ScoreFactorsDTO.builder()
                .creditItems(factors)
                .disputesByStatus(disputesByStatus)
                .totalNegativeItems(safeItems.size())
                .resolvedItems(factors.stream().mapToLong(ItemFactorDTO::getResolvedCount).sum())
                .totalDisputes(totalDisputes)
                .successRate(successRate)
                .build();
    }

    public List<RecommendationDTO> recommend(int averageScore, ScoreFactorsDTO factors) {
        List<RecommendationDTO> out = new ArrayList<>();

        if (averageScore < DISPUTE_SCORE_THRESHOLD) {
            out.add(new RecommendationDTO(Priority.HIGH, "Dispute negative items",
                    "Focus on removing inaccurate or outdated items from your credit report"));
        }
        if (hasItemType(factors, ItemType.LATE_PAYMENT)) {
            out.add(new RecommendationDTO(Priority.HIGH, "Address late payments",
                    "Recent late payments significantly impact your score"));
        }
        if (hasItemType(factors, ItemType.COLLECTION)) {
            out.add(new RecommendationDTO(Priority.HIGH, "Resolve collections",
                    "Collections accounts require immediate attention"));
        }
        out.add(new RecommendationDTO(Priority.MEDIUM, "Monitor progress",
                "Check score regularly to track improvement"));

        return out;
    }

    private static boolean hasItemType(ScoreFactorsDTO factors, ItemType type) {
        return factors != null && factors.getCreditItems() != null
                && factors.getCreditItems().stream().anyMatch(f -> f.getItemType() == type);
    }

    private record FactorKey(ItemType itemType, ItemStatus status) {
        static final Comparator<FactorKey> ORDER = Comparator
                .comparing(FactorKey::itemType)
                .thenComparing(FactorKey::status);
    }
}
