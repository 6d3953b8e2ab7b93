package com.creditpath.backend.entities;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import com.creditpath.backend.enums.Bureau;
import com.creditpath.backend.enums.DisputeStatus;
import com.creditpath.backend.enums.DisputeType;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DisputeAttempt {

    UUID id;
    UUID clientId;
    UUID creditItemId;
    Bureau bureau;
    DisputeType disputeType;
    DisputeStatus status;
    LocalDate sentDate;
    LocalDateTime createdAt;

    /**
     * Date the dispute counts from: when it was mailed, or when it was created if
     * no sent date was recorded.
     */
    public LocalDate effectiveDate() {
        if (sentDate != null) {
            return sentDate;
        }
        return createdAt != null ? createdAt.toLocalDate() : null;
    }
}
