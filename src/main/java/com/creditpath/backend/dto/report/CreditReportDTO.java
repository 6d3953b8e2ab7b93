package com.creditpath.backend.dto.report;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.creditpath.backend.dto.anomaly.AnomalyReportDTO;
import com.creditpath.backend.dto.projection.ProjectionReportDTO;
import com.creditpath.backend.dto.score.BureauComparisonDTO;
import com.creditpath.backend.dto.score.TrendResultDTO;
import com.creditpath.backend.enums.Bureau;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CreditReportDTO {
    private UUID clientId;
    private LocalDate reportDate;
    private BureauComparisonDTO comparison;
    private Map<Bureau, TrendResultDTO> trends;
    private ScoreFactorsDTO factors;
    private List<RecommendationDTO> recommendations;
    private AnomalyReportDTO anomalies;
    private ProjectionReportDTO projection;
    private LocalDateTime generatedAt;
}
