package com.flowmable.splitter;

/**
 * Axis-aligned pixel rectangle, half-open: covers {@code [x1, x2) × [y1, y2)}.
 *
 * @param x1 Left edge (inclusive)
 * @param y1 Top edge (inclusive)
 * @param x2 Right edge (exclusive)
 * @param y2 Bottom edge (exclusive)
 */
public record Box(int x1, int y1, int x2, int y2) {

    public int width() {
        return x2 - x1;
    }

    public int height() {
        return y2 - y1;
    }

    public int area() {
        return width() * height();
    }

    public boolean isEmpty() {
        return x2 <= x1 || y2 <= y1;
    }

    /**
     * Grow the box by {@code padding} on every side, clamped to a
     * {@code frameWidth × frameHeight} frame.
     */
    public Box padded(int padding, int frameWidth, int frameHeight) {
        return new Box(
                Math.max(0, x1 - padding),
                Math.max(0, y1 - padding),
                Math.min(frameWidth, x2 + padding),
                Math.min(frameHeight, y2 + padding));
    }
}
