package com.creditpath.backend.dto.anomaly;

import java.time.LocalDate;
import java.util.List;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AnomalyReportDTO {
    private List<AnomalyAlertDTO> alerts;
    private int totalAlerts;
    private int criticalCount;
    private int warningCount;
    private int infoCount;
    private LocalDate windowStart;
    private LocalDate asOf;

    public boolean isHasAnomalies() {
        return totalAlerts > 0;
    }
}
