package com.netlink.osp.network;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PonPortStatus {
    AVAILABLE("available"),
    ACTIVE("active"),
    RESERVED("reserved"),
    FAULTY("faulty");

    private final String code;

    PonPortStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static PonPortStatus fromCode(String text) {
        for (PonPortStatus s : values()) {
            if (s.code.equalsIgnoreCase(text) || s.name().equalsIgnoreCase(text))
                return s;
        }
        throw new IllegalArgumentException("Unknown PON port status: " + text);
    }
}
