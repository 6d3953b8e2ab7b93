package com.creditpath.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Priority {
    CRITICAL("critical"),
    HIGH("high"),
    MEDIUM("medium");

    private final String code;

    Priority(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
