package com.netlink.osp.network;

/** Cable role of a hierarchy edge, by the element types it joins. */
public enum EdgeCategory {
    /** Leaves an OLT or ODF. */
    FEEDER,
    /** Runs between closures and into LCPs. */
    DISTRIBUTION,
    /** Ends at a NAP. */
    DROP;

    public static EdgeCategory between(ElementType source, ElementType target) {
        if (target == ElementType.NAP)
            return DROP;
        if (source == ElementType.OLT || source == ElementType.ODF)
            return FEEDER;
        return DISTRIBUTION;
    }
}
