package com.netlink.osp.network;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.netlink.osp.loss.LossTables;

/** Split ratio of a passive optical splitter. */
public enum SplitterRatio {
    ONE_BY_2("1:2", 2),
    ONE_BY_4("1:4", 4),
    ONE_BY_8("1:8", 8),
    ONE_BY_16("1:16", 16),
    ONE_BY_32("1:32", 32);

    private final String code;
    private final int outputs;

    SplitterRatio(String code, int outputs) {
        this.code = code;
        this.outputs = outputs;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public int outputs() {
        return outputs;
    }

    /** Insertion loss in dB, from the additional-loss table. */
    public double insertionLossDb() {
        return LossTables.ADDITIONAL_LOSSES.get("splitter_1x" + outputs);
    }

    @JsonCreator
    public static SplitterRatio fromCode(String text) {
        for (SplitterRatio r : values()) {
            if (r.code.equals(text) || r.name().equalsIgnoreCase(text))
                return r;
        }
        throw new IllegalArgumentException("Unknown splitter ratio: " + text);
    }
}
