package com.netlink.osp.splice;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Splice method with its TIA-568 loss classification row. Fusion bounds are
 * tighter than mechanical ones.
 */
public enum SpliceType {
    FUSION("fusion", new LossThresholds(0.1, 0.15, 0.3)),
    MECHANICAL("mechanical", new LossThresholds(0.2, 0.3, 0.5));

    private static final Map<SpliceType, LossThresholds> TABLE;

    static {
        Map<SpliceType, LossThresholds> m = new EnumMap<>(SpliceType.class);
        for (SpliceType t : values())
            m.put(t, t.thresholds);
        TABLE = Collections.unmodifiableMap(m);
    }

    private final String code;
    private final LossThresholds thresholds;

    SpliceType(String code, LossThresholds thresholds) {
        this.code = code;
        this.thresholds = thresholds;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public LossThresholds thresholds() {
        return thresholds;
    }

    /** The complete classification table, one row per method. */
    public static Map<SpliceType, LossThresholds> thresholdTable() {
        return TABLE;
    }

    @JsonCreator
    public static SpliceType fromCode(String text) {
        for (SpliceType t : values()) {
            if (t.code.equalsIgnoreCase(text) || t.name().equalsIgnoreCase(text))
                return t;
        }
        throw new IllegalArgumentException("Unknown splice type: " + text);
    }
}
