package com.netlink.osp.splice;

/**
 * Upper bounds (dB, inclusive) of the good, acceptable and high loss classes
 * for one splice method. Anything above {@code max} fails.
 */
public record LossThresholds(double good, double acceptable, double max) {

    public LossThresholds {
        if (!(good <= acceptable && acceptable <= max))
            throw new IllegalArgumentException("Thresholds must be ordered: " + good + ", " + acceptable + ", " + max);
    }

    public LossClass classify(double loss) {
        if (loss <= good)
            return LossClass.GOOD;
        if (loss <= acceptable)
            return LossClass.ACCEPTABLE;
        if (loss <= max)
            return LossClass.HIGH;
        return LossClass.FAILED;
    }
}
