package com.creditpath.backend.enums;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome assumed for the round before the current one.
 */
public enum PreviousResult {
    NONE("none"),
    RESOLVED("resolved"),
    VERIFIED("verified");

    private final String code;

    PreviousResult(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static PreviousResult fromCode(String code) {
        if (code == null || code.isBlank()) {
            return NONE;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (PreviousResult result : values()) {
            if (result.code.equals(normalized)) {
                return result;
            }
        }
        return NONE;
    }
}
