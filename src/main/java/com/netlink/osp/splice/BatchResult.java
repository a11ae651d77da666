package com.netlink.osp.splice;

import java.util.List;

/** Per-pair outcomes of a committed batch, in ascending pair order. */
public record BatchResult(List<SpliceResult> results) {

    public BatchResult {
        results = List.copyOf(results);
    }

    public int created() {
        return count(SpliceOutcome.CREATED);
    }

    public int skipped() {
        return count(SpliceOutcome.ALREADY_EXISTS);
    }

    private int count(SpliceOutcome outcome) {
        int n = 0;
        for (SpliceResult r : results) {
            if (r.outcome() == outcome)
                n++;
        }
        return n;
    }
}
