package com.netlink.osp.network;

import java.util.Map;

/**
 * Totals for the subtree under one element, the element included.
 *
 * @param connectedPorts ports in {@code connected} state
 */
public record HierarchyStats(long rootId, int elementCount, Map<ElementType, Integer> countByType, int trays,
        int ports, int connectedPorts) {

    /** Share of ports in use, 0..100; 0 when the subtree has no ports. */
    public double portUtilization() {
        return ports == 0 ? 0 : connectedPorts * 100.0 / ports;
    }
}
