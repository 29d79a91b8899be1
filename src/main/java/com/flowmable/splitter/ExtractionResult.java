package com.flowmable.splitter;

import java.util.List;

/**
 * Outcome of one extraction run.
 *
 * @param mode       Strategy that produced the sprites (never AUTO)
 * @param annotation Free-text manifest line, e.g. {@code Grid: 4x3, period: 100x100}
 * @param sprites    Sprites in final index order
 */
public record ExtractionResult(ExtractionMode mode, String annotation, List<SpriteRecord> sprites) {

    public ExtractionResult {
        sprites = List.copyOf(sprites);
    }

    public static ExtractionResult empty(ExtractionMode mode, String annotation) {
        return new ExtractionResult(mode, annotation, List.of());
    }
}
