package com.netlink.osp.network;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PortStatus {
    AVAILABLE("available"),
    CONNECTED("connected"),
    RESERVED("reserved"),
    FAULTY("faulty");

    private final String code;

    PortStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static PortStatus fromCode(String text) {
        for (PortStatus s : values()) {
            if (s.code.equalsIgnoreCase(text) || s.name().equalsIgnoreCase(text))
                return s;
        }
        throw new IllegalArgumentException("Unknown port status: " + text);
    }
}
