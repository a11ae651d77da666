package com.netlink.osp.color;

/**
 * Resolved identity of one fiber inside a cable.
 *
 * @param fiberNumber    global 1-based fiber index in the cable
 * @param tubeNumber     1-based buffer tube holding the fiber
 * @param positionInTube 1-based position inside the tube (1..12)
 * @param tubeColor      color of the buffer tube
 * @param fiberColor     color of the fiber itself
 */
public record FiberInfo(int fiberNumber, int tubeNumber, int positionInTube,
        FiberColor tubeColor, FiberColor fiberColor) {

    /** Short "Tube/Fiber" label, e.g. {@code Blue/Orange}. */
    public String label() {
        return tubeColor.displayName() + "/" + fiberColor.displayName();
    }
}
