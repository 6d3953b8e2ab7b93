package com.creditpath.backend.dto.report;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import com.creditpath.backend.enums.DisputeStatus;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ScoreFactorsDTO {
    private List<ItemFactorDTO> creditItems;
    private Map<DisputeStatus, Long> disputesByStatus;
    private long totalNegativeItems;
    private long resolvedItems;
    private long totalDisputes;
    private BigDecimal successRate; // percent of disputes resolved
}
