package com.flowmable.splitter;

/**
 * Binary erosion and dilation with a 3×3 square structuring element.
 * <p>
 * The square element is separable, so each iteration runs as a horizontal
 * pass followed by a vertical pass. Cells outside the frame count as
 * background, so erosion eats in from the image edges.
 */
public final class Morphology {

    private Morphology() {}

    public static ForegroundMask dilate(ForegroundMask mask, int iterations) {
        boolean[] current = mask.bits().clone();
        for (int i = 0; i < iterations; i++) {
            current = pass(current, mask.width(), mask.height(), false);
        }
        return new ForegroundMask(mask.width(), mask.height(), current);
    }

    public static ForegroundMask erode(ForegroundMask mask, int iterations) {
        boolean[] current = mask.bits().clone();
        for (int i = 0; i < iterations; i++) {
            current = pass(current, mask.width(), mask.height(), true);
        }
        return new ForegroundMask(mask.width(), mask.height(), current);
    }

    /** Erode then dilate; removes thin bridges while roughly keeping region extent. */
    public static ForegroundMask open(ForegroundMask mask, int iterations) {
        return dilate(erode(mask, iterations), iterations);
    }

    private static boolean[] pass(boolean[] src, int w, int h, boolean erode) {
        boolean[] horizontal = new boolean[src.length];
        for (int y = 0; y < h; y++) {
            int row = y * w;
            for (int x = 0; x < w; x++) {
                boolean left = x > 0 && src[row + x - 1];
                boolean right = x < w - 1 && src[row + x + 1];
                horizontal[row + x] = combine(left, src[row + x], right, erode);
            }
        }
        boolean[] out = new boolean[src.length];
        for (int y = 0; y < h; y++) {
            int row = y * w;
            for (int x = 0; x < w; x++) {
                boolean up = y > 0 && horizontal[row - w + x];
                boolean down = y < h - 1 && horizontal[row + w + x];
                out[row + x] = combine(up, horizontal[row + x], down, erode);
            }
        }
        return out;
    }

    private static boolean combine(boolean before, boolean center, boolean after, boolean erode) {
        return erode ? before && center && after : before || center || after;
    }
}
