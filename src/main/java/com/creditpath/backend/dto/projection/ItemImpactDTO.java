package com.creditpath.backend.dto.projection;

import java.util.UUID;

import com.creditpath.backend.enums.Bureau;
import com.creditpath.backend.enums.ItemType;
import com.creditpath.backend.enums.Priority;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ItemImpactDTO {
    private UUID creditItemId;
    private ItemType itemType;
    private String creditorName;
    private Bureau bureau;
    private int estimatedMin;
    private int estimatedMax;
    private Priority priority;

    public int getAverageGain() {
        return (int) Math.round((estimatedMin + estimatedMax) / 2.0);
    }
}
