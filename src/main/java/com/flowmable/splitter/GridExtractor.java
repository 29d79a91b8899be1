package com.flowmable.splitter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Splits a sheet laid out on a regular grid.
 * <p>
 * Pipeline:
 * 1. Foreground mask, column and row density profiles.
 * 2. Period per axis, forced ({@code extent / count}) or spectral; phase by {@link PhaseAligner}.
 * 3. Cell boundaries covering the full frame.
 * 4. Per cell: occupancy filter, tighten to content, pad, size filter.
 * 5. Row-major indexing.
 * <p>
 * When either period cannot be determined the result is empty; no partial grid is emitted.
 */
public class GridExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(GridExtractor.class);

    private final ExtractionOptions options;

    public GridExtractor() {
        this(ExtractionOptions.DEFAULT);
    }

    public GridExtractor(ExtractionOptions options) {
        this.options = options;
    }

    public ExtractionResult extract(BufferedImage image, BackgroundModel background, String baseName) {
        int w = image.getWidth();
        int h = image.getHeight();

        // 1. Mask + profiles
        ForegroundMask mask = background.mask(image);
        LOG.info("Sprite pixels: {}%", String.format(Locale.ROOT, "%.1f", mask.coverage() * 100));

        // 2. Geometry
        GridGeometry geometry = detectGeometry(mask);
        if (geometry == null) {
            LOG.warn("Could not detect grid period. Try --mode detect or specify --cols/--rows.");
            return ExtractionResult.empty(ExtractionMode.GRID, "Grid: no period detected");
        }
        int nominalColumns = geometry.nominalColumns(w);
        int nominalRows = geometry.nominalRows(h);
        LOG.info("Grid: {} cols (period={}px) x {} rows (period={}px)",
                nominalColumns, geometry.columnPeriod(), nominalRows, geometry.rowPeriod());
        LOG.info("Offset: col={}, row={}", geometry.columnOffset(), geometry.rowOffset());

        // 3-5. Cells in row-major order
        int[] cols = geometry.columnBoundaries();
        int[] rows = geometry.rowBoundaries();
        List<SpriteRecord> sprites = new ArrayList<>();
        int index = 0;
        for (int ri = 0; ri < rows.length - 1; ri++) {
            for (int ci = 0; ci < cols.length - 1; ci++) {
                Box cell = new Box(cols[ci], rows[ri], cols[ci + 1], rows[ri + 1]);
                Box crop = trimCell(mask, cell);
                if (crop == null) continue;
                sprites.add(SpriteRecord.of(index++, baseName, crop, new GridPosition(ri, ci)));
            }
        }

        String annotation = String.format(Locale.ROOT, "Grid: %dx%d, period: %dx%d",
                nominalColumns, nominalRows, geometry.columnPeriod(), geometry.rowPeriod());
        return new ExtractionResult(ExtractionMode.GRID, annotation, sprites);
    }

    /**
     * Period and phase for both axes of {@code mask}.
     *
     * @return the geometry, or null when a period is undetectable
     */
    public GridGeometry detectGeometry(ForegroundMask mask) {
        double[] columnProfile = mask.columnProfile();
        double[] rowProfile = mask.rowProfile();

        OptionalInt columnPeriod = axisPeriod(columnProfile, options.columns());
        OptionalInt rowPeriod = axisPeriod(rowProfile, options.rows());
        if (columnPeriod.isEmpty() || rowPeriod.isEmpty()) {
            return null;
        }

        int columnOffset = PhaseAligner.findOffset(columnProfile, columnPeriod.getAsInt());
        int rowOffset = PhaseAligner.findOffset(rowProfile, rowPeriod.getAsInt());
        return GridGeometry.of(columnPeriod.getAsInt(), columnOffset, rowPeriod.getAsInt(), rowOffset,
                mask.width(), mask.height());
    }

    private OptionalInt axisPeriod(double[] profile, Integer forcedCount) {
        if (forcedCount != null) {
            return OptionalInt.of(Math.max(1, profile.length / forcedCount));
        }
        return SpectralPeriodEstimator.findPeriod(profile, options.minPeriod());
    }

    /**
     * Tighten a cell to its foreground, pad it, and apply the occupancy and size filters.
     *
     * @return the crop box, or null when the cell yields no sprite
     */
    private Box trimCell(ForegroundMask mask, Box cell) {
        if (cell.isEmpty()) return null;

        double occupancy = (double) mask.countWithin(cell) / cell.area();
        if (occupancy < options.occupancyThreshold()) {
            return null;
        }

        Box content = mask.boundsWithin(cell);
        if (content == null) return null;

        Box crop = content.padded(options.padding(), mask.width(), mask.height());
        if (crop.width() < options.minSize() || crop.height() < options.minSize()) {
            LOG.debug("Skipping cell {} ({}x{} below min size)", cell, crop.width(), crop.height());
            return null;
        }
        return crop;
    }
}
