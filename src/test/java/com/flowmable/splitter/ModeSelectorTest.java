package com.flowmable.splitter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModeSelectorTest {

    private final BackgroundModel white = SyntheticSheets.whiteBackground();

    @Test
    void regularGrid_choosesGrid() {
        assertEquals(ExtractionMode.GRID, new ModeSelector().chooseMode(SyntheticSheets.regularGrid(), white));
    }

    @Test
    void uniformSheet_choosesDetect() {
        assertEquals(ExtractionMode.DETECT,
                new ModeSelector().chooseMode(SyntheticSheets.uniform(400, 300, SyntheticSheets.WHITE), white));
    }

    @Test
    void weakPeriodicity_choosesDetect() {
        ExtractionOptions strict = new ExtractionOptions(ExtractionMode.AUTO, 20, 2, null, null, 30, 0,
                null, null, 50, 0.05, 1e9, 50, 3);
        assertEquals(ExtractionMode.DETECT,
                new ModeSelector(strict).chooseMode(SyntheticSheets.regularGrid(), white));
    }

    @Test
    void regularGrid_strongColumnSpectrum() {
        ForegroundMask mask = white.mask(SyntheticSheets.regularGrid());
        assertTrue(SpectralPeriodEstimator.peakToMeanRatio(mask.columnProfile())
                > ExtractionOptions.DEFAULT.peakToMeanThreshold());
    }
}
