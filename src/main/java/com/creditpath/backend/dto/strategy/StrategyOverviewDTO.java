package com.creditpath.backend.dto.strategy;

import java.util.List;

import com.creditpath.backend.services.strategy.BureauProfile;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class StrategyOverviewDTO {
    private List<RoundDTO> rounds;
    private List<BureauProfile> bureaus;
    private List<ItemTypeSummaryDTO> itemTypes;
}
