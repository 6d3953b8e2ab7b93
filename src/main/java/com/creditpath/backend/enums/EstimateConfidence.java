package com.creditpath.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EstimateConfidence {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String code;

    EstimateConfidence(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static EstimateConfidence forItemCount(int totalNegativeItems) {
        if (totalNegativeItems <= 3) return HIGH;
        if (totalNegativeItems <= 7) return MEDIUM;
        return LOW;
    }
}
