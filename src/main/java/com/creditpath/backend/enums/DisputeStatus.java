package com.creditpath.backend.enums;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DisputeStatus {
    DRAFT("draft"),
    SENT("sent"),
    RECEIVED("received"),
    INVESTIGATING("investigating"),
    RESOLVED("resolved"),
    REJECTED("rejected");

    private final String code;

    DisputeStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Anything past {@link #DRAFT} has left the office.
     */
    public boolean isSent() {
        return this != DRAFT;
    }

    public static DisputeStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (DisputeStatus status : values()) {
            if (status.code.equals(normalized)) {
                return status;
            }
        }
        return null;
    }
}
