package com.flowmable.splitter;

import java.awt.image.BufferedImage;

/**
 * Background classification by distance to one or two reference colors.
 * <p>
 * A pixel is background when its Euclidean RGB distance to either reference
 * color is within the tolerance. The second reference exists for sheets whose
 * "transparent" checkerboard was flattened into two alternating solid colors.
 */
public final class BackgroundModel {

    private final Rgb primary;
    private final Rgb secondary;
    private final double tolerance;

    /**
     * @param primary   Main background color
     * @param secondary Optional second color; may be null
     * @param tolerance Distance threshold, inclusive
     */
    public BackgroundModel(Rgb primary, Rgb secondary, double tolerance) {
        if (primary == null) {
            throw new IllegalArgumentException("primary background color must not be null");
        }
        this.primary = primary;
        this.secondary = secondary;
        this.tolerance = tolerance;
    }

    /**
     * Build a model for {@code image} from the options: explicit colors when
     * given, the corner estimate otherwise.
     */
    public static BackgroundModel resolve(BufferedImage image, ExtractionOptions options) {
        Rgb primary = options.background() != null ? options.background() : estimateBackground(image);
        return new BackgroundModel(primary, options.background2(), options.tolerance());
    }

    /**
     * Average of the four corner pixels.
     */
    public static Rgb estimateBackground(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        double r = 0, g = 0, b = 0;
        for (int y : new int[]{0, h - 1}) {
            for (int x : new int[]{0, w - 1}) {
                int argb = image.getRGB(x, y);
                r += (argb >> 16) & 0xFF;
                g += (argb >> 8) & 0xFF;
                b += argb & 0xFF;
            }
        }
        return new Rgb(r / 4.0, g / 4.0, b / 4.0);
    }

    /**
     * Foreground mask of {@code image} against {@code bg1} and optionally {@code bg2}.
     *
     * @param bg2 may be null
     */
    public static ForegroundMask buildMask(BufferedImage image, Rgb bg1, double tolerance, Rgb bg2) {
        return new BackgroundModel(bg1, bg2, tolerance).mask(image);
    }

    public ForegroundMask mask(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] pixels = image.getRGB(0, 0, w, h, null, 0, w);
        boolean[] bits = new boolean[w * h];
        for (int i = 0; i < pixels.length; i++) {
            bits[i] = !isBackground(pixels[i]);
        }
        return new ForegroundMask(w, h, bits);
    }

    public boolean isBackground(int argb) {
        if (primary.distanceToArgb(argb) <= tolerance) return true;
        return secondary != null && secondary.distanceToArgb(argb) <= tolerance;
    }

    public Rgb primary() {
        return primary;
    }

    /** May be null. */
    public Rgb secondary() {
        return secondary;
    }

    public double tolerance() {
        return tolerance;
    }
}
