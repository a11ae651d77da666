package com.netlink.osp.loss;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Test wavelengths in nanometers. */
public enum Wavelength {
    NM_850(850),
    NM_1300(1300),
    NM_1310(1310),
    NM_1550(1550);

    private final int nanometers;

    Wavelength(int nanometers) {
        this.nanometers = nanometers;
    }

    @JsonValue
    public int nanometers() {
        return nanometers;
    }

    @JsonCreator
    public static Wavelength of(int nanometers) {
        for (Wavelength w : values()) {
            if (w.nanometers == nanometers)
                return w;
        }
        throw new IllegalArgumentException("Unsupported wavelength: " + nanometers + " nm");
    }
}
