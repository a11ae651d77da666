package com.netlink.osp.network;

/**
 * Spacing for {@link HierarchyLayout}. The defaults fit a 180x60 node with 70
 * units between columns and 60 between rows.
 */
public record LayoutOptions(double columnWidth, double rowHeight) {

    public static final LayoutOptions DEFAULTS = new LayoutOptions(250, 120);

    public LayoutOptions {
        if (!(columnWidth > 0) || !(rowHeight > 0))
            throw new IllegalArgumentException("Layout spacing must be positive: " + columnWidth + "x" + rowHeight);
    }
}
