package com.creditpath.backend.dto.projection;

import java.util.UUID;

import com.creditpath.backend.enums.ItemType;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TimelineStepDTO {
    private int step;
    private UUID creditItemId;
    private ItemType itemType;
    private String creditorName;
    private int expectedGain;
    private int projectedScore;
}
