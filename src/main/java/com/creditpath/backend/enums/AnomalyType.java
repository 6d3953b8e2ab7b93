package com.creditpath.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyType {
    SUDDEN_DROP("sudden_drop"),
    BUREAU_INCONSISTENCY("bureau_inconsistency"),
    STAGNATION("stagnation"),
    APPROACHING_EXPIRATION("approaching_expiration");

    private final String code;

    AnomalyType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
