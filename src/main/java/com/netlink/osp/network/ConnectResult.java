package com.netlink.osp.network;

/**
 * Outcome of {@link NetworkGraph#connect(long, long)}. A rejected connection
 * leaves the graph untouched and carries the reason.
 */
public record ConnectResult(Status status, long sourceId, long targetId, String reason) {

    public enum Status {
        CONNECTED,
        /** Target already hangs off the source. */
        UNCHANGED,
        REJECTED
    }

    public static ConnectResult connected(long sourceId, long targetId) {
        return new ConnectResult(Status.CONNECTED, sourceId, targetId, null);
    }

    public static ConnectResult unchanged(long sourceId, long targetId) {
        return new ConnectResult(Status.UNCHANGED, sourceId, targetId, null);
    }

    public static ConnectResult rejected(long sourceId, long targetId, String reason) {
        return new ConnectResult(Status.REJECTED, sourceId, targetId, reason);
    }

    public boolean isRejected() {
        return status == Status.REJECTED;
    }
}
