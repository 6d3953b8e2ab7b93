package com.creditpath.backend.dto.report;

import com.creditpath.backend.enums.ItemStatus;
import com.creditpath.backend.enums.ItemType;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ItemFactorDTO {
    private ItemType itemType;
    private ItemStatus status;
    private long count;
    private long resolvedCount;
}
