package com.netlink.osp.loss;

/**
 * Loss budget split by contributor, each rounded to 0.01 dB.
 * {@code totalLoss} is the sum of the five terms.
 */
public record LossBudgetBreakdown(double fiberLoss, double fusionLoss, double mechanicalLoss,
        double connectorLoss, double marginLoss, double totalLoss, Details details) {

    /** Unrounded per-unit values the terms were computed from. */
    public record Details(double fiberAttenuation, double fusionSpliceValue, double mechanicalSpliceValue,
            double connectorValue) {
    }
}
