package com.flowmable.splitter;

import java.util.Locale;

/**
 * One extracted sprite, as listed in the manifest.
 *
 * @param index        Sequential 0-based index, assigned after any re-sorting
 * @param fileName     Output file name, {@code {basename}_{index:03d}.png}
 * @param width        Width of the output image in pixels
 * @param height       Height of the output image in pixels
 * @param sourceBox    Crop box in source image coordinates (padding included)
 * @param gridPosition Grid cell the sprite came from; null for region-detected sprites
 */
public record SpriteRecord(
        int index,
        String fileName,
        int width,
        int height,
        Box sourceBox,
        GridPosition gridPosition
) {

    public static SpriteRecord of(int index, String baseName, Box sourceBox, GridPosition gridPosition) {
        return new SpriteRecord(index, fileName(baseName, index),
                sourceBox.width(), sourceBox.height(), sourceBox, gridPosition);
    }

    public static String fileName(String baseName, int index) {
        return String.format(Locale.ROOT, "%s_%03d.png", baseName, index);
    }

    public boolean hasGridPosition() {
        return gridPosition != null;
    }
}
