package com.netlink.osp.color;

/**
 * One buffer tube of a cable.
 * <p>
 * {@code tubeGroup} distinguishes repeated tube colors in cables with more
 * than 12 tubes (tube 13 is blue again, in group 2).
 */
public record TubeInfo(int tubeNumber, FiberColor tubeColor, int tubeGroup, int startFiber, int endFiber) {

    public int fiberCount() {
        return endFiber - startFiber + 1;
    }
}
