package com.flowmable.splitter;

import java.util.Arrays;

/**
 * Per-pixel component labels: 0 is background, 1..{@link #count()} identify
 * connected components. Row-major, same dimensions as the labeled mask.
 */
public final class RegionLabelMap {

    private final int width;
    private final int height;
    private final int[] labels;
    private final int count;

    RegionLabelMap(int width, int height, int[] labels, int count) {
        this.width = width;
        this.height = height;
        this.labels = labels;
        this.count = count;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int label(int x, int y) {
        return labels[y * width + x];
    }

    /** Number of components. */
    public int count() {
        return count;
    }

    /**
     * Tight bounding box of each component, restricted to the cells where
     * {@code within} is set. Index {@code i} holds label {@code i + 1}; an entry
     * is null when the component has no cell in {@code within}.
     */
    public Box[] bounds(ForegroundMask within) {
        int[] minX = new int[count + 1];
        int[] minY = new int[count + 1];
        int[] maxX = new int[count + 1];
        int[] maxY = new int[count + 1];
        Arrays.fill(minX, Integer.MAX_VALUE);
        Arrays.fill(minY, Integer.MAX_VALUE);
        Arrays.fill(maxX, -1);
        Arrays.fill(maxY, -1);

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int id = labels[y * width + x];
                if (id == 0 || !within.get(x, y)) continue;
                if (x < minX[id]) minX[id] = x;
                if (x > maxX[id]) maxX[id] = x;
                if (y < minY[id]) minY[id] = y;
                if (y > maxY[id]) maxY[id] = y;
            }
        }

        Box[] boxes = new Box[count];
        for (int id = 1; id <= count; id++) {
            if (maxX[id] >= 0) {
                boxes[id - 1] = new Box(minX[id], minY[id], maxX[id] + 1, maxY[id] + 1);
            }
        }
        return boxes;
    }
}
