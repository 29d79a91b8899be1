package com.flowmable.splitter;

/**
 * Tunables for one extraction run.
 * <p>
 * The occupancy and peak/mean thresholds are empirical; keep them as defaults
 * unless a sheet needs otherwise.
 *
 * @param mode                Requested strategy; AUTO defers to {@link ModeSelector}
 * @param minSize             Minimum accepted sprite width and height, pixels
 * @param padding             Padding around each tightened box, pixels
 * @param background          Primary background color; null to estimate from the corners
 * @param background2         Second background color for two-tone checkerboards; may be null
 * @param tolerance           Euclidean RGB distance at or below which a pixel is background
 * @param erosion             Opening iterations before labeling; 0 dilates by {@code defaultDilation}
 * @param columns             Forced column count; null to detect
 * @param rows                Forced row count; null to detect
 * @param minPeriod           Shortest grid period the spectral search accepts, pixels
 * @param occupancyThreshold  Minimum foreground fraction of a grid cell
 * @param peakToMeanThreshold Spectral peak/mean ratio above which AUTO picks GRID
 * @param rowBandHeight       Band height for reading-order sort of detected regions
 * @param defaultDilation     Dilation iterations used when {@code erosion == 0}
 */
public record ExtractionOptions(
        ExtractionMode mode,
        int minSize,
        int padding,
        Rgb background,
        Rgb background2,
        double tolerance,
        int erosion,
        Integer columns,
        Integer rows,
        int minPeriod,
        double occupancyThreshold,
        double peakToMeanThreshold,
        int rowBandHeight,
        int defaultDilation
) {

    public static final ExtractionOptions DEFAULT = new ExtractionOptions(
            ExtractionMode.AUTO,
            20,   // minSize
            2,    // padding
            null, // background (corner estimate)
            null, // background2
            30.0, // tolerance
            0,    // erosion
            null, // columns
            null, // rows
            50,   // minPeriod
            0.05, // occupancyThreshold
            5.0,  // peakToMeanThreshold
            50,   // rowBandHeight
            3     // defaultDilation
    );

    public ExtractionOptions {
        if (mode == null) throw new IllegalArgumentException("mode must not be null");
        if (minSize < 0) throw new IllegalArgumentException("minSize must be >= 0: " + minSize);
        if (padding < 0) throw new IllegalArgumentException("padding must be >= 0: " + padding);
        if (tolerance < 0) throw new IllegalArgumentException("tolerance must be >= 0: " + tolerance);
        if (erosion < 0) throw new IllegalArgumentException("erosion must be >= 0: " + erosion);
        if (columns != null && columns <= 0) throw new IllegalArgumentException("columns must be > 0: " + columns);
        if (rows != null && rows <= 0) throw new IllegalArgumentException("rows must be > 0: " + rows);
        if (minPeriod < 1) throw new IllegalArgumentException("minPeriod must be >= 1: " + minPeriod);
        if (rowBandHeight < 1) throw new IllegalArgumentException("rowBandHeight must be >= 1: " + rowBandHeight);
        if (defaultDilation < 0) throw new IllegalArgumentException("defaultDilation must be >= 0: " + defaultDilation);
    }

    public ExtractionOptions withMode(ExtractionMode mode) {
        return new ExtractionOptions(mode, minSize, padding, background, background2, tolerance, erosion,
                columns, rows, minPeriod, occupancyThreshold, peakToMeanThreshold, rowBandHeight, defaultDilation);
    }

    public ExtractionOptions withMinSize(int minSize) {
        return new ExtractionOptions(mode, minSize, padding, background, background2, tolerance, erosion,
                columns, rows, minPeriod, occupancyThreshold, peakToMeanThreshold, rowBandHeight, defaultDilation);
    }

    public ExtractionOptions withPadding(int padding) {
        return new ExtractionOptions(mode, minSize, padding, background, background2, tolerance, erosion,
                columns, rows, minPeriod, occupancyThreshold, peakToMeanThreshold, rowBandHeight, defaultDilation);
    }

    public ExtractionOptions withBackground(Rgb background, Rgb background2) {
        return new ExtractionOptions(mode, minSize, padding, background, background2, tolerance, erosion,
                columns, rows, minPeriod, occupancyThreshold, peakToMeanThreshold, rowBandHeight, defaultDilation);
    }

    public ExtractionOptions withTolerance(double tolerance) {
        return new ExtractionOptions(mode, minSize, padding, background, background2, tolerance, erosion,
                columns, rows, minPeriod, occupancyThreshold, peakToMeanThreshold, rowBandHeight, defaultDilation);
    }

    public ExtractionOptions withErosion(int erosion) {
        return new ExtractionOptions(mode, minSize, padding, background, background2, tolerance, erosion,
                columns, rows, minPeriod, occupancyThreshold, peakToMeanThreshold, rowBandHeight, defaultDilation);
    }

    public ExtractionOptions withGrid(Integer columns, Integer rows) {
        return new ExtractionOptions(mode, minSize, padding, background, background2, tolerance, erosion,
                columns, rows, minPeriod, occupancyThreshold, peakToMeanThreshold, rowBandHeight, defaultDilation);
    }

    public ExtractionOptions withMinPeriod(int minPeriod) {
        return new ExtractionOptions(mode, minSize, padding, background, background2, tolerance, erosion,
                columns, rows, minPeriod, occupancyThreshold, peakToMeanThreshold, rowBandHeight, defaultDilation);
    }
}
