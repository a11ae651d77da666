package com.netlink.osp.splice;

/** What a splice write did to the tray. */
public enum SpliceOutcome {
    CREATED,
    /** The pair existed and was overwritten in place. */
    UPDATED,
    /** The pair existed and was left alone (batch insert skips it). */
    ALREADY_EXISTS
}
