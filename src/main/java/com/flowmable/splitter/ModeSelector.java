package com.flowmable.splitter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.Locale;

/**
 * One-shot choice between grid and region extraction.
 * <p>
 * GRID requires a detectable period on both axes and a column spectrum whose
 * peak stands out from the mean by more than the configured ratio; anything
 * else is DETECT. There is no retry: the caller commits to the answer.
 */
public class ModeSelector {

    private static final Logger LOG = LoggerFactory.getLogger(ModeSelector.class);

    private final ExtractionOptions options;

    public ModeSelector() {
        this(ExtractionOptions.DEFAULT);
    }

    public ModeSelector(ExtractionOptions options) {
        this.options = options;
    }

    /**
     * @return {@link ExtractionMode#GRID} or {@link ExtractionMode#DETECT}, never AUTO
     */
    public ExtractionMode chooseMode(BufferedImage image, BackgroundModel background) {
        ForegroundMask mask = background.mask(image);
        double[] columnProfile = mask.columnProfile();
        double[] rowProfile = mask.rowProfile();

        boolean periodic = SpectralPeriodEstimator.findPeriod(columnProfile, options.minPeriod()).isPresent()
                && SpectralPeriodEstimator.findPeriod(rowProfile, options.minPeriod()).isPresent();
        if (!periodic) {
            LOG.debug("No period on at least one axis");
            return ExtractionMode.DETECT;
        }

        double strength = SpectralPeriodEstimator.peakToMeanRatio(columnProfile);
        LOG.debug("Column spectrum peak/mean: {}", String.format(Locale.ROOT, "%.2f", strength));
        return strength > options.peakToMeanThreshold() ? ExtractionMode.GRID : ExtractionMode.DETECT;
    }
}
