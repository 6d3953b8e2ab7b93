package com.creditpath.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ScoreMovement {
    UP("up"),
    DOWN("down"),
    NEW("new");

    private final String code;

    ScoreMovement(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
