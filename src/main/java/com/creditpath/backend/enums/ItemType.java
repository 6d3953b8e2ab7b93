package com.creditpath.backend.enums;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ItemType {
    LATE_PAYMENT("late_payment"),
    COLLECTION("collection"),
    CHARGE_OFF("charge_off"),
    BANKRUPTCY("bankruptcy"),
    FORECLOSURE("foreclosure"),
    REPOSSESSION("repossession"),
    INQUIRY("inquiry"),
    OTHER("other");

    private final String code;

    ItemType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Unknown or missing codes map to {@link #OTHER}; legacy rows may carry values
     * that upstream validation no longer accepts.
     */
    public static ItemType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return OTHER;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (ItemType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
