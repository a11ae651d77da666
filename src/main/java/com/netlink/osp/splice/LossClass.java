package com.netlink.osp.splice;

/** Quality class of a measured splice loss. */
public enum LossClass {
    GOOD,
    ACCEPTABLE,
    /** Above typical but within the method's maximum. */
    HIGH,
    FAILED,
    /** No measurement recorded. */
    MISSING;

    public boolean isPassing() {
        return this == GOOD || this == ACCEPTABLE;
    }
}
