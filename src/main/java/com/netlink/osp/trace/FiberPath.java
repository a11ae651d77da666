package com.netlink.osp.trace;

import java.util.List;

/**
 * Result of tracing one fiber through the network.
 *
 * @param segments            elements on the path, head end first
 * @param totalLossDb         splice and splitter loss along the path, rounded
 *                            to 0.01 dB
 * @param totalDistanceMeters summed length of the cables between segments
 *                            whose length is recorded
 * @param ponPortNumber       OLT PON port feeding the path, when an LCP on it
 *                            has one assigned
 * @param missingLinks        human-readable breaks found while tracing
 */
public record FiberPath(long startElementId, Integer startFiber, List<PathSegment> segments, double totalLossDb,
        double totalDistanceMeters, int spliceCount, int connectorCount, Integer ponPortNumber,
        List<String> missingLinks, boolean loopDetected) {

    public enum Status {
        /** Reached the head end with no break. */
        COMPLETE,
        /** Stopped at a break or a loop. */
        PARTIAL
    }

    public Status status() {
        return missingLinks.isEmpty() ? Status.COMPLETE : Status.PARTIAL;
    }

    public PathSegment start() {
        return segments.get(0);
    }

    public PathSegment end() {
        return segments.get(segments.size() - 1);
    }
}
