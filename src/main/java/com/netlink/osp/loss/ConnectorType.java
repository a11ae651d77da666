package com.netlink.osp.loss;

public enum ConnectorType {
    LC,
    SC,
    FC,
    ST,
    MPO,
    MTP;

    public static ConnectorType fromString(String text) {
        for (ConnectorType c : values()) {
            if (c.name().equalsIgnoreCase(text))
                return c;
        }
        throw new IllegalArgumentException("Unknown connector type: " + text);
    }
}
