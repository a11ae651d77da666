package com.netlink.osp.splice;

import java.util.Objects;

import com.netlink.osp.api.ValidationException;
import com.netlink.osp.network.Cable;

/**
 * 1:1 splice run between two cables: pairs
 * {@code (startFiberA + i, startFiberB + i)} for {@code i} in
 * {@code [0, count)}.
 */
public record BatchSpliceRequest(long trayId, Cable cableA, Cable cableB, int startFiberA, int startFiberB,
        int count, SpliceType spliceType, String technicianName) {

    public BatchSpliceRequest {
        Objects.requireNonNull(cableA, "cableA");
        Objects.requireNonNull(cableB, "cableB");
        if (count < 0)
            throw new ValidationException("Batch count must be >= 0: " + count);
    }
}
