package com.netlink.osp.splice;

import java.util.List;

/** Documentation check of one splice. */
public record ComplianceResult(Status status, List<String> issues, LossClass lossClass) {

    public enum Status {
        PASS,
        WARN,
        FAIL
    }

    public ComplianceResult {
        issues = List.copyOf(issues);
    }
}
