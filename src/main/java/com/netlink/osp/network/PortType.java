package com.netlink.osp.network;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PortType {
    INPUT("input"),
    OUTPUT("output"),
    BIDIRECTIONAL("bidirectional");

    private final String code;

    PortType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static PortType fromCode(String text) {
        for (PortType t : values()) {
            if (t.code.equalsIgnoreCase(text) || t.name().equalsIgnoreCase(text))
                return t;
        }
        throw new IllegalArgumentException("Unknown port type: " + text);
    }
}
