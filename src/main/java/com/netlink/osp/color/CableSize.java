package com.netlink.osp.color;

import java.util.Optional;

/**
 * Standard outside-plant cable fiber counts. Every size is built from
 * 12-fiber buffer tubes.
 */
public enum CableSize {
    F12(12),
    F24(24),
    F48(48),
    F96(96),
    F144(144),
    F216(216),
    F288(288);

    private final int fiberCount;

    CableSize(int fiberCount) {
        this.fiberCount = fiberCount;
    }

    public int fiberCount() {
        return fiberCount;
    }

    public int tubeCount() {
        return fiberCount / FiberColor.SEQUENCE_LENGTH;
    }

    public static Optional<CableSize> of(int fiberCount) {
        for (CableSize s : values()) {
            if (s.fiberCount == fiberCount)
                return Optional.of(s);
        }
        return Optional.empty();
    }

    public static boolean isSupported(int fiberCount) {
        return of(fiberCount).isPresent();
    }
}
