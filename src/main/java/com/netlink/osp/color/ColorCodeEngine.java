package com.netlink.osp.color;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Bidirectional mapping between a fiber's global index and its
 * (tube, position, color) identity.
 *
 * <p>
 * Layout rules, for a cable of {@code fiberCount} fibers:
 * <ul>
 * <li>{@code tubeNumber = ceil(fiberNumber / 12)}</li>
 * <li>{@code positionInTube = ((fiberNumber - 1) mod 12) + 1}</li>
 * <li>tube and fiber colors both come from {@link FiberColor}, wrapping every
 * 12 entries</li>
 * <li>{@code tubeGroup = ceil(tubeNumber / 12)}</li>
 * </ul>
 *
 * <p>
 * Every method is total: an index outside the cable yields
 * {@link Optional#empty()} or an empty list instead of an exception, so a
 * caller can render a placeholder.
 */
public final class ColorCodeEngine {
    public static final int FIBERS_PER_TUBE = FiberColor.SEQUENCE_LENGTH;

    private ColorCodeEngine() {
        // Utility class
    }

    /** Resolves a global fiber index. Empty if outside {@code 1..fiberCount}. */
    public static Optional<FiberInfo> fiberInfo(int fiberNumber, int fiberCount) {
        if (fiberCount < 1 || fiberNumber < 1 || fiberNumber > fiberCount)
            return Optional.empty();
        int tube = (fiberNumber - 1) / FIBERS_PER_TUBE + 1;
        int position = (fiberNumber - 1) % FIBERS_PER_TUBE + 1;
        return Optional.of(new FiberInfo(fiberNumber, tube, position,
                FiberColor.forPosition(tube), FiberColor.forPosition(position)));
    }

    /**
     * Inverse of {@link #fiberInfo(int, int)}. Empty when the tube or position
     * does not exist in a cable of this size (including positions past the end
     * of a short last tube).
     */
    public static Optional<Integer> fiberNumber(int tubeNumber, int positionInTube, int fiberCount) {
        if (fiberCount < 1 || tubeNumber < 1 || tubeNumber > tubeCount(fiberCount))
            return Optional.empty();
        if (positionInTube < 1 || positionInTube > FIBERS_PER_TUBE)
            return Optional.empty();
        long fiber = (long) (tubeNumber - 1) * FIBERS_PER_TUBE + positionInTube;
        return fiber <= fiberCount ? Optional.of((int) fiber) : Optional.empty();
    }

    public static int tubeCount(int fiberCount) {
        if (fiberCount < 1)
            return 0;
        return (fiberCount - 1) / FIBERS_PER_TUBE + 1;
    }

    /** All tubes of a cable, in order. The last tube may be partially filled. */
    public static List<TubeInfo> tubesFor(int fiberCount) {
        int tubes = tubeCount(fiberCount);
        if (tubes == 0)
            return Collections.emptyList();
        List<TubeInfo> out = new ArrayList<>(tubes);
        for (int t = 1; t <= tubes; t++) {
            int start = (t - 1) * FIBERS_PER_TUBE + 1;
            int end = (int) Math.min((long) t * FIBERS_PER_TUBE, fiberCount);
            int group = (t - 1) / FIBERS_PER_TUBE + 1;
            out.add(new TubeInfo(t, FiberColor.forPosition(t), group, start, end));
        }
        return Collections.unmodifiableList(out);
    }

    /** Fibers of a single tube in position order. Empty for an unknown tube. */
    public static List<FiberInfo> fibersInTube(int tubeNumber, int fiberCount) {
        if (tubeNumber < 1 || tubeNumber > tubeCount(fiberCount))
            return Collections.emptyList();
        List<FiberInfo> out = new ArrayList<>(FIBERS_PER_TUBE);
        for (int p = 1; p <= FIBERS_PER_TUBE; p++) {
            fiberNumber(tubeNumber, p, fiberCount)
                    .flatMap(n -> fiberInfo(n, fiberCount))
                    .ifPresent(out::add);
        }
        return Collections.unmodifiableList(out);
    }

    /** {@code "Tube/Fiber"} label, or empty for an out-of-range fiber. */
    public static Optional<String> formatColor(int fiberNumber, int fiberCount) {
        return fiberInfo(fiberNumber, fiberCount).map(FiberInfo::label);
    }
}
