package com.creditpath.backend.dto.report;

import com.creditpath.backend.enums.Priority;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationDTO {
    private Priority priority;
    private String action;
    private String description;
}
