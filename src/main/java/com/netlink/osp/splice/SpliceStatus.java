package com.netlink.osp.splice;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SpliceStatus {
    PENDING("pending"),
    COMPLETED("completed"),
    NEEDS_REVIEW("needs-review"),
    FAILED("failed");

    private final String code;

    SpliceStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** Status implied by a recorded loss: completed once measured. */
    public static SpliceStatus forLoss(Double loss) {
        return loss != null ? COMPLETED : PENDING;
    }

    @JsonCreator
    public static SpliceStatus fromCode(String text) {
        for (SpliceStatus s : values()) {
            if (s.code.equalsIgnoreCase(text) || s.name().equalsIgnoreCase(text))
                return s;
        }
        throw new IllegalArgumentException("Unknown splice status: " + text);
    }
}
