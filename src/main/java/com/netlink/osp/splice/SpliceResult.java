package com.netlink.osp.splice;

/** A splice write outcome plus the stored record. */
public record SpliceResult(SpliceOutcome outcome, Splice splice) {
}
