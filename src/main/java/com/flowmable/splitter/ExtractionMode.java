package com.flowmable.splitter;

import java.util.Locale;

/**
 * Sprite extraction strategy.
 */
public enum ExtractionMode {
    /** Regular grid inferred from spectral periodicity (or forced dimensions). */
    GRID,
    /** Connected foreground regions, for irregular layouts. */
    DETECT,
    /** Let {@link ModeSelector} decide between GRID and DETECT. */
    AUTO;

    public static ExtractionMode parse(String text) {
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown mode '" + text + "', expected grid, detect or auto", e);
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
