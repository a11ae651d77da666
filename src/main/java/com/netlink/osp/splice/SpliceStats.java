package com.netlink.osp.splice;

/**
 * Aggregate view over a set of splices. Loss figures cover only splices with a
 * recorded loss and are 0 when there are none. {@code passRate} is the
 * percentage (0..100) of all splices whose loss classifies as good or
 * acceptable.
 */
public record SpliceStats(int total, int completed, int pending, int needsReview, int failed,
        int withLoss, double avgLoss, double minLoss, double maxLoss, double passRate) {
}
