package com.creditpath.backend.enums;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ItemStatus {
    IDENTIFIED("identified"),
    DISPUTING("disputing"),
    VERIFIED("verified"),
    UPDATED("updated"),
    DELETED("deleted");

    private final String code;

    ItemStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isActive() {
        return this != DELETED;
    }

    public static ItemStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (ItemStatus status : values()) {
            if (status.code.equals(normalized)) {
                return status;
            }
        }
        return null;
    }
}
