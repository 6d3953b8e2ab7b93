package com.creditpath.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DisputeType {
    NOT_MINE("not_mine"),
    PAID("paid"),
    INACCURATE_INFO("inaccurate_info"),
    OUTDATED("outdated"),
    DUPLICATE("duplicate"),
    OTHER("other");

    private final String code;

    DisputeType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
