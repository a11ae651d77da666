package com.netlink.osp.loss;

/** Typical and worst-case loss of one component, in dB. */
public record LossValue(double typical, double max) {

    public double pick(boolean useMax) {
        return useMax ? max : typical;
    }
}
