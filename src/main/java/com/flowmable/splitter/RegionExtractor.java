package com.flowmable.splitter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splits a sheet with an irregular layout into connected foreground regions.
 * <p>
 * The mask is smoothed before labeling: an opening by {@code erosion}
 * iterations when configured (breaks anti-aliasing bridges between sprites),
 * otherwise a dilation by {@code defaultDilation} iterations (merges nearby
 * fragments of one sprite). Each component is then bounded over the original,
 * unsmoothed foreground, padded, size-filtered and sorted into reading order:
 * coarse row bands of {@code rowBandHeight} pixels, left to right within a band.
 */
public class RegionExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(RegionExtractor.class);

    private final ExtractionOptions options;

    public RegionExtractor() {
        this(ExtractionOptions.DEFAULT);
    }

    public RegionExtractor(ExtractionOptions options) {
        this.options = options;
    }

    public ExtractionResult extract(BufferedImage image, BackgroundModel background, String baseName) {
        int w = image.getWidth();
        int h = image.getHeight();

        ForegroundMask mask = background.mask(image);

        ForegroundMask processed = options.erosion() > 0
                ? Morphology.open(mask, options.erosion())
                : Morphology.dilate(mask, options.defaultDilation());

        RegionLabelMap labels = ConnectedComponentLabeler.label(processed);
        LOG.info("Found {} connected regions", labels.count());

        List<Box> crops = new ArrayList<>();
        for (Box content : labels.bounds(mask)) {
            if (content == null) continue;
            Box crop = content.padded(options.padding(), w, h);
            if (crop.width() < options.minSize() || crop.height() < options.minSize()) {
                LOG.debug("Skipping region {} ({}x{} below min size)", content, crop.width(), crop.height());
                continue;
            }
            crops.add(crop);
        }

        // Stable sort keeps label order within equal keys
        int band = options.rowBandHeight();
        crops.sort(Comparator.<Box>comparingInt(b -> b.y1() / band).thenComparingInt(Box::x1));

        List<SpriteRecord> sprites = new ArrayList<>(crops.size());
        for (int i = 0; i < crops.size(); i++) {
            sprites.add(SpriteRecord.of(i, baseName, crops.get(i), null));
        }
        return new ExtractionResult(ExtractionMode.DETECT, "Mode: detect", sprites);
    }
}
