package com.flowmable.splitter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionOptionsTest {

    @Test
    void defaults() {
        ExtractionOptions d = ExtractionOptions.DEFAULT;
        assertEquals(ExtractionMode.AUTO, d.mode());
        assertEquals(20, d.minSize());
        assertEquals(2, d.padding());
        assertEquals(30.0, d.tolerance());
        assertEquals(50, d.minPeriod());
        assertEquals(0.05, d.occupancyThreshold());
        assertEquals(5.0, d.peakToMeanThreshold());
        assertNull(d.background());
        assertNull(d.columns());
    }

    @Test
    void withers_changeOnlyTheirField() {
        ExtractionOptions o = ExtractionOptions.DEFAULT.withPadding(7).withGrid(4, null);
        assertEquals(7, o.padding());
        assertEquals(4, o.columns());
        assertNull(o.rows());
        assertEquals(ExtractionOptions.DEFAULT.minSize(), o.minSize());
        assertEquals(2, ExtractionOptions.DEFAULT.padding());
    }

    @Test
    void rejectsInvalidValues() {
        ExtractionOptions d = ExtractionOptions.DEFAULT;
        assertThrows(IllegalArgumentException.class, () -> d.withMode(null));
        assertThrows(IllegalArgumentException.class, () -> d.withPadding(-1));
        assertThrows(IllegalArgumentException.class, () -> d.withGrid(0, 3));
        assertThrows(IllegalArgumentException.class, () -> d.withGrid(3, -2));
        assertThrows(IllegalArgumentException.class, () -> d.withMinPeriod(0));
        assertThrows(IllegalArgumentException.class, () -> d.withTolerance(-0.5));
    }

    @Test
    void parseMode_caseInsensitive() {
        assertEquals(ExtractionMode.GRID, ExtractionMode.parse("Grid"));
        assertEquals("detect", ExtractionMode.DETECT.label());
        assertThrows(IllegalArgumentException.class, () -> ExtractionMode.parse("spiral"));
    }
}
