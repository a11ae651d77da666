package com.netlink.osp.splice;

import java.util.Objects;

import com.netlink.osp.network.Cable;

/**
 * Input of {@link SpliceContinuityStore#createOrUpdateSplice}. A null
 * {@code spliceType} or {@code technicianName} falls back to the session
 * defaults.
 */
public record SpliceRequest(long trayId, Cable cableA, int fiberA, Cable cableB, int fiberB,
        SpliceType spliceType, Double loss, String technicianName, String notes, Long otdrTraceId) {

    public SpliceRequest {
        Objects.requireNonNull(cableA, "cableA");
        Objects.requireNonNull(cableB, "cableB");
    }

    public static SpliceRequest of(long trayId, Cable cableA, int fiberA, Cable cableB, int fiberB) {
        return new SpliceRequest(trayId, cableA, fiberA, cableB, fiberB, null, null, null, null, null);
    }

    public SpliceRequest withType(SpliceType type) {
        return new SpliceRequest(trayId, cableA, fiberA, cableB, fiberB, type, loss, technicianName, notes, otdrTraceId);
    }

    public SpliceRequest withLoss(Double dB) {
        return new SpliceRequest(trayId, cableA, fiberA, cableB, fiberB, spliceType, dB, technicianName, notes, otdrTraceId);
    }

    public SpliceRequest withTechnician(String name) {
        return new SpliceRequest(trayId, cableA, fiberA, cableB, fiberB, spliceType, loss, name, notes, otdrTraceId);
    }

    public SpliceRequest withNotes(String text) {
        return new SpliceRequest(trayId, cableA, fiberA, cableB, fiberB, spliceType, loss, technicianName, text, otdrTraceId);
    }

    public SpliceRequest withOtdrTrace(Long traceId) {
        return new SpliceRequest(trayId, cableA, fiberA, cableB, fiberB, spliceType, loss, technicianName, notes, traceId);
    }
}
