package com.creditpath.backend.services.anomalies;

import java.util.List;

import com.creditpath.backend.dto.anomaly.AnomalyAlertDTO;

public interface AnomalyCheck {
    List<AnomalyAlertDTO> check(AnomalyContext context);
}
