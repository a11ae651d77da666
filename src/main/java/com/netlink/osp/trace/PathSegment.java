package com.netlink.osp.trace;

import java.util.Optional;

import com.netlink.osp.color.ColorCodeEngine;
import com.netlink.osp.color.FiberInfo;
import com.netlink.osp.network.ElementType;
import com.netlink.osp.network.PortStatus;
import com.netlink.osp.network.SplitterRatio;
import com.netlink.osp.splice.SpliceStatus;

/**
 * One element on a traced fiber path, in head-end to customer order.
 * {@code fiberIn} is the fiber arriving from upstream, {@code fiberOut} the
 * fiber leaving downstream; either is null where it is not known.
 */
public record PathSegment(int order, long elementId, ElementType type, String name, Integer fiberIn,
        Integer fiberOut, SpliceHop splice, SplitterHop splitter, PortHop port) {

    /** Splice the fiber passes through inside a tray of this element. */
    public record SpliceHop(long spliceId, long trayId, int trayNumber, double lossDb, boolean measured,
            SpliceStatus status) {
    }

    public record SplitterHop(long splitterId, String name, SplitterRatio ratio, double lossDb) {
    }

    public record PortHop(long portId, int portNumber, PortStatus status, String customerName, String serviceId) {
    }

    public Optional<FiberInfo> fiberInColor() {
        return colorOf(fiberIn);
    }

    public Optional<FiberInfo> fiberOutColor() {
        return colorOf(fiberOut);
    }

    // Colors depend only on the index, so the index itself bounds the cable
    private static Optional<FiberInfo> colorOf(Integer fiber) {
        return fiber == null ? Optional.empty() : ColorCodeEngine.fiberInfo(fiber, fiber);
    }
}
