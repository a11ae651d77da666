package com.netlink.osp.splice;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.netlink.osp.color.ColorCodeEngine;
import com.netlink.osp.color.FiberInfo;

/**
 * Fiber-by-fiber grid between two cables. Row {@code a-1} holds fiber
 * {@code a} of cable A against every fiber of cable B; a cell carries the
 * existing splice for that pair, if any.
 */
public final class SpliceMatrix {

    public record Cell(int fiberA, int fiberB, FiberInfo colorA, FiberInfo colorB, Splice splice) {
        public boolean isSpliced() {
            return splice != null;
        }
    }

    private final int countA, countB;
    private final List<List<Cell>> rows;

    private SpliceMatrix(int countA, int countB, List<List<Cell>> rows) {
        this.countA = countA;
        this.countB = countB;
        this.rows = rows;
    }

    public static SpliceMatrix build(int cableACount, int cableBCount, Collection<Splice> existing) {
        Map<Long, Splice> byPair = new HashMap<>(existing.size() * 2);
        for (Splice s : existing)
            byPair.put(key(s.getFiberA(), s.getFiberB()), s);

        List<FiberInfo> colorsB = new ArrayList<>(Math.max(cableBCount, 0));
        for (int b = 1; b <= cableBCount; b++)
            ColorCodeEngine.fiberInfo(b, cableBCount).ifPresent(colorsB::add);

        List<List<Cell>> rows = new ArrayList<>(Math.max(cableACount, 0));
        for (int a = 1; a <= cableACount; a++) {
            Optional<FiberInfo> colorA = ColorCodeEngine.fiberInfo(a, cableACount);
            if (colorA.isEmpty())
                continue;
            List<Cell> row = new ArrayList<>(colorsB.size());
            for (FiberInfo colorB : colorsB) {
                int b = colorB.fiberNumber();
                row.add(new Cell(a, b, colorA.get(), colorB, byPair.get(key(a, b))));
            }
            rows.add(List.copyOf(row));
        }
        return new SpliceMatrix(cableACount, cableBCount, List.copyOf(rows));
    }

    public int rowCount() {
        return rows.size();
    }

    /** Cells of fiber {@code fiberA} of cable A. Empty if outside the cable. */
    public List<Cell> row(int fiberA) {
        if (fiberA < 1 || fiberA > rows.size())
            return List.of();
        return rows.get(fiberA - 1);
    }

    public Optional<Cell> cell(int fiberA, int fiberB) {
        if (fiberA < 1 || fiberA > countA || fiberB < 1 || fiberB > countB)
            return Optional.empty();
        return Optional.of(rows.get(fiberA - 1).get(fiberB - 1));
    }

    public List<List<Cell>> rows() {
        return rows;
    }

    private static long key(int a, int b) {
        return ((long) a << 32) | (b & 0xffffffffL);
    }
}
