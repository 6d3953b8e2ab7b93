package com.creditpath.backend.enums;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Bureau {
    EXPERIAN("experian", "Experian"),
    EQUIFAX("equifax", "Equifax"),
    TRANSUNION("transunion", "TransUnion");

    private final String code;
    private final String displayName;

    Bureau(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves a bureau code case-insensitively. Unknown, blank and "all" codes
     * resolve to empty: callers decide the fallback.
     */
    public static Optional<Bureau> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Bureau bureau : values()) {
            if (bureau.code.equals(normalized)) {
                return Optional.of(bureau);
            }
        }
        return Optional.empty();
    }
}
