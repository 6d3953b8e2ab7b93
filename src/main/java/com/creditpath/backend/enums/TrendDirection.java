package com.creditpath.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {
    INSUFFICIENT_DATA("insufficient_data"),
    IMPROVING("improving"),
    DECLINING("declining"),
    STABLE("stable");

    private final String code;

    TrendDirection(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
