package com.flowmable.splitter;

import java.util.ArrayList;
import java.util.List;

/**
 * Period and phase for both axes, with the derived cell boundaries.
 * <p>
 * Boundary arrays are strictly increasing, start at 0 and end at the image
 * extent, so the cells always cover the whole frame.
 *
 * @param columnPeriod       Column spacing, pixels
 * @param columnOffset       Column phase in [0, columnPeriod)
 * @param rowPeriod          Row spacing, pixels
 * @param rowOffset          Row phase in [0, rowPeriod)
 * @param columnBoundaries   x positions of the cell edges
 * @param rowBoundaries      y positions of the cell edges
 */
public record GridGeometry(
        int columnPeriod,
        int columnOffset,
        int rowPeriod,
        int rowOffset,
        int[] columnBoundaries,
        int[] rowBoundaries
) {

    public static GridGeometry of(int columnPeriod, int columnOffset, int rowPeriod, int rowOffset,
                                  int width, int height) {
        return new GridGeometry(columnPeriod, columnOffset, rowPeriod, rowOffset,
                boundaries(columnOffset, columnPeriod, width),
                boundaries(rowOffset, rowPeriod, height));
    }

    /**
     * Grid lines at {@code offset, offset + period, ...} up to {@code extent},
     * with 0 and {@code extent} added when the walk misses them.
     */
    public static int[] boundaries(int offset, int period, int extent) {
        if (period <= 0) {
            throw new IllegalArgumentException("period must be > 0: " + period);
        }
        List<Integer> lines = new ArrayList<>();
        for (int p = offset; p <= extent; p += period) {
            lines.add(p);
        }
        if (lines.isEmpty() || lines.get(0) > 0) {
            lines.add(0, 0);
        }
        if (lines.get(lines.size() - 1) < extent) {
            lines.add(extent);
        }
        return lines.stream().mapToInt(Integer::intValue).toArray();
    }

    /** Nominal column count, {@code width / columnPeriod} rounded half-even. */
    public int nominalColumns(int width) {
        return (int) Math.rint((double) width / columnPeriod);
    }

    /** Nominal row count, {@code height / rowPeriod} rounded half-even. */
    public int nominalRows(int height) {
        return (int) Math.rint((double) height / rowPeriod);
    }
}
