package com.creditpath.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import com.creditpath.backend.enums.Bureau;
import com.creditpath.backend.enums.ItemStatus;
import com.creditpath.backend.enums.ItemType;

import lombok.Builder;
import lombok.Value;

/**
 * A negative tradeline on a client's report. A null bureau means the item is
 * reported by all three bureaus.
 */
@Value
@Builder
public class NegativeItem {

    UUID id;
    UUID clientId;
    ItemType itemType;
    String creditorName;
    BigDecimal balance;
    Bureau bureau;
    ItemStatus status;
    LocalDate dateOpened;
    LocalDate dateReported;

    public ItemType getItemType() {
        return itemType != null ? itemType : ItemType.OTHER;
    }

    /**
     * Items without a status are still being identified and count as active.
     */
    public boolean isActive() {
        return status == null || status.isActive();
    }
}
