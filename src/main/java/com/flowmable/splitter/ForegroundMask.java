package com.flowmable.splitter;

/**
 * Binary per-pixel classification of an image; {@code true} means "not background".
 * Stored row-major.
 */
public final class ForegroundMask {

    private final int width;
    private final int height;
    private final boolean[] bits;

    public ForegroundMask(int width, int height) {
        this(width, height, new boolean[width * height]);
    }

    ForegroundMask(int width, int height, boolean[] bits) {
        if (bits.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " cells, got " + bits.length);
        }
        this.width = width;
        this.height = height;
        this.bits = bits;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean get(int x, int y) {
        return bits[y * width + x];
    }

    public void set(int x, int y, boolean value) {
        bits[y * width + x] = value;
    }

    boolean[] bits() {
        return bits;
    }

    public int count() {
        int n = 0;
        for (boolean bit : bits) {
            if (bit) n++;
        }
        return n;
    }

    /** Fraction of all cells that are foreground, in [0, 1]. */
    public double coverage() {
        return bits.length == 0 ? 0.0 : (double) count() / bits.length;
    }

    /** Foreground count per column; length equals {@link #width()}. */
    public double[] columnProfile() {
        double[] profile = new double[width];
        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int x = 0; x < width; x++) {
                if (bits[row + x]) profile[x]++;
            }
        }
        return profile;
    }

    /** Foreground count per row; length equals {@link #height()}. */
    public double[] rowProfile() {
        double[] profile = new double[height];
        for (int y = 0; y < height; y++) {
            int row = y * width;
            int n = 0;
            for (int x = 0; x < width; x++) {
                if (bits[row + x]) n++;
            }
            profile[y] = n;
        }
        return profile;
    }

    /** Number of foreground cells inside {@code box}. */
    public int countWithin(Box box) {
        int n = 0;
        for (int y = box.y1(); y < box.y2(); y++) {
            int row = y * width;
            for (int x = box.x1(); x < box.x2(); x++) {
                if (bits[row + x]) n++;
            }
        }
        return n;
    }

    /**
     * Tight bounding box of the foreground cells inside {@code box}.
     *
     * @return the bounds, or null when the box holds no foreground
     */
    public Box boundsWithin(Box box) {
        int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE;
        int maxX = -1, maxY = -1;
        for (int y = box.y1(); y < box.y2(); y++) {
            int row = y * width;
            for (int x = box.x1(); x < box.x2(); x++) {
                if (!bits[row + x]) continue;
                if (x < minX) minX = x;
                if (x > maxX) maxX = x;
                if (y < minY) minY = y;
                if (y > maxY) maxY = y;
            }
        }
        if (maxX < 0) return null;
        return new Box(minX, minY, maxX + 1, maxY + 1);
    }
}
