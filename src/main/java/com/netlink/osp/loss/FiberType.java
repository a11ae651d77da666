package com.netlink.osp.loss;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FiberType {
    SINGLEMODE("singlemode"),
    MULTIMODE("multimode");

    private final String code;

    FiberType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static FiberType fromCode(String text) {
        for (FiberType t : values()) {
            if (t.code.equalsIgnoreCase(text) || t.name().equalsIgnoreCase(text))
                return t;
        }
        throw new IllegalArgumentException("Unknown fiber type: " + text);
    }
}
