package com.creditpath.backend.dto.anomaly;

import java.util.UUID;

import com.creditpath.backend.enums.AlertSeverity;
import com.creditpath.backend.enums.AnomalyType;
import com.creditpath.backend.enums.Bureau;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AnomalyAlertDTO {
    private AnomalyType type;
    private AlertSeverity severity;
    private Bureau bureau; // null for cross-bureau alerts
    private UUID creditItemId;
    private String message;
    private String recommendation;
}
