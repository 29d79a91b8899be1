package com.flowmable.splitter;

import java.util.Locale;

/**
 * A background reference color in RGB space.
 * <p>
 * Components are real-valued (0–255 scale) so that a color averaged from several
 * pixels is not quantized before distance computation.
 *
 * @param r Red channel
 * @param g Green channel
 * @param b Blue channel
 */
public record Rgb(double r, double g, double b) {

    /**
     * Create an Rgb from a packed ARGB pixel, ignoring alpha.
     */
    public static Rgb fromArgb(int argb) {
        return new Rgb((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF);
    }

    /**
     * Parse a color written as {@code R,G,B}, e.g. {@code 255,0,255}.
     *
     * @throws IllegalArgumentException if the text is not three comma-separated numbers
     */
    public static Rgb parse(String text) {
        String[] parts = text.split(",");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Expected a color as R,G,B but got: " + text);
        }
        try {
            return new Rgb(
                    Double.parseDouble(parts[0].trim()),
                    Double.parseDouble(parts[1].trim()),
                    Double.parseDouble(parts[2].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected a color as R,G,B but got: " + text, e);
        }
    }

    /**
     * Euclidean distance in RGB space.
     */
    public double distance(Rgb other) {
        double dr = r - other.r;
        double dg = g - other.g;
        double db = b - other.b;
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }

    /**
     * Euclidean distance to the RGB part of a packed ARGB pixel.
     */
    public double distanceToArgb(int argb) {
        double dr = ((argb >> 16) & 0xFF) - r;
        double dg = ((argb >> 8) & 0xFF) - g;
        double db = (argb & 0xFF) - b;
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }

    /** Rounded form for log output, e.g. {@code (255, 0, 255)}. */
    public String describe() {
        return String.format(Locale.ROOT, "(%.0f, %.0f, %.0f)", r, g, b);
    }
}
