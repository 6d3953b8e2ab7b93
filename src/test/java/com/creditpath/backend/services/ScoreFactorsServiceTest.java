package com.creditpath.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import com.creditpath.backend.dto.report.ItemFactorDTO;
import com.creditpath.backend.dto.report.RecommendationDTO;
import com.creditpath.backend.dto.report.ScoreFactorsDTO;
import com.creditpath.backend.entities.DisputeAttempt;
import com.creditpath.backend.entities.NegativeItem;
import com.creditpath.backend.enums.DisputeStatus;
import com.creditpath.backend.enums.ItemStatus;
import com.creditpath.backend.enums.ItemType;
import com.creditpath.backend.enums.Priority;

class ScoreFactorsServiceTest {

    private final ScoreFactorsService service = new ScoreFactorsService();

    @Test
    void groupsItemsByTypeAndStatus() {
        ScoreFactorsDTO factors = service.analyzeFactors(List.of(
                item(ItemType.COLLECTION, ItemStatus.IDENTIFIED),
                item(ItemType.COLLECTION, null),
                item(ItemType.COLLECTION, ItemStatus.DELETED),
                item(ItemType.LATE_PAYMENT, ItemStatus.DISPUTING)), List.of());

        List<ItemFactorDTO> rows = factors.getCreditItems();
        assertEquals(3, rows.size());
        assertEquals(ItemType.LATE_PAYMENT, rows.get(0).getItemType());
        assertEquals(ItemType.COLLECTION, rows.get(1).getItemType());
        assertEquals(ItemStatus.IDENTIFIED, rows.get(1).getStatus());
        assertEquals(2, rows.get(1).getCount());
        assertEquals(1, rows.get(2).getResolvedCount());

        assertEquals(4, factors.getTotalNegativeItems());
        assertEquals(1, factors.getResolvedItems());
        assertEquals(0, factors.getTotalDisputes());
        assertEquals(new BigDecimal("0.0"), factors.getSuccessRate());
    }

    @Test
    void successRateIsShareOfResolvedDisputes() {
        ScoreFactorsDTO factors = service.analyzeFactors(List.of(), List.of(
                dispute(DisputeStatus.RESOLVED),
                dispute(DisputeStatus.REJECTED),
                dispute(DisputeStatus.SENT)));

        assertEquals(3, factors.getTotalDisputes());
        assertEquals(1L, factors.getDisputesByStatus().get(DisputeStatus.RESOLVED));
        assertEquals(new BigDecimal("33.3"), factors.getSuccessRate());
    }

    @Test
    void recommendationsDependOnScoreAndItems() {
        ScoreFactorsDTO factors = service.analyzeFactors(List.of(
                item(ItemType.LATE_PAYMENT, ItemStatus.IDENTIFIED),
                item(ItemType.COLLECTION, ItemStatus.IDENTIFIED)), List.of());

        List<RecommendationDTO> low = service.recommend(600, factors);
        assertEquals(List.of("Dispute negative items", "Address late payments", "Resolve collections", "Monitor progress"),
                low.stream().map(RecommendationDTO::getAction).toList());
        assertEquals(Priority.HIGH, low.get(0).getPriority());

        List<RecommendationDTO> clean = service.recommend(720, service.analyzeFactors(List.of(), List.of()));
        assertEquals(1, clean.size());
        assertEquals(Priority.MEDIUM, clean.get(0).getPriority());
        assertTrue(clean.get(0).getDescription().contains("track improvement"));
    }

    private static NegativeItem item(ItemType type, ItemStatus status) {
        return NegativeItem.builder().id(UUID.randomUUID()).itemType(type).status(status).build();
    }

    private static DisputeAttempt dispute(DisputeStatus status) {
        return DisputeAttempt.builder().id(UUID.randomUUID()).status(status).build();
    }
}
