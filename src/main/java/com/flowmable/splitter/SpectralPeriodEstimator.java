package com.flowmable.splitter;

import java.util.OptionalInt;

/**
 * Dominant-period search over a 1D density profile.
 * <p>
 * Sprite/gap alternation along an axis is quasi-periodic, so the grid spacing
 * shows up as the strongest bin in the magnitude spectrum of the mean-removed
 * profile. Two bands are excluded before the peak search:
 * - bins 0 and 1, and any bin whose period exceeds half the profile length
 * - bins whose period is shorter than the minimum period
 */
public final class SpectralPeriodEstimator {

    private static final int MIN_PROFILE_LENGTH = 4;
    private static final double EPSILON = 1e-10;

    private SpectralPeriodEstimator() {}

    /**
     * Find the dominant period of {@code profile}.
     *
     * @param profile   Density samples, e.g. column sums of a foreground mask
     * @param minPeriod Shortest acceptable period in samples
     * @return the period in samples, or empty when no bin survives the exclusions
     */
    public static OptionalInt findPeriod(double[] profile, int minPeriod) {
        int n = profile.length;
        if (n < MIN_PROFILE_LENGTH) {
            return OptionalInt.empty();
        }
        double[] magnitude = magnitudeSpectrum(profile);
        double maxFrequency = minPeriod > 0 ? 1.0 / minPeriod : 1.0;

        for (int k = 0; k < magnitude.length; k++) {
            // k < 2 covers every period longer than n / 2
            double frequency = (double) k / n;
            if (k < 2 || frequency > maxFrequency) {
                magnitude[k] = 0.0;
            }
        }

        // Ties resolve to the lowest bin
        int peak = 0;
        for (int k = 1; k < magnitude.length; k++) {
            if (magnitude[k] > magnitude[peak]) peak = k;
        }
        if (peak == 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) Math.rint((double) n / peak));
    }

    /**
     * Ratio of the largest spectral magnitude to the mean magnitude over all bins.
     * High values mean one period dominates the profile.
     */
    public static double peakToMeanRatio(double[] profile) {
        if (profile.length == 0) return 0.0;
        double[] magnitude = magnitudeSpectrum(profile);
        double max = 0;
        double sum = 0;
        for (double m : magnitude) {
            if (m > max) max = m;
            sum += m;
        }
        return max / (sum / magnitude.length + EPSILON);
    }

    /**
     * Magnitude of the real-input DFT of the mean-removed profile.
     * Bin {@code k} (0..n/2) corresponds to frequency {@code k / n}.
     */
    public static double[] magnitudeSpectrum(double[] profile) {
        int n = profile.length;
        if (n == 0) return new double[0];

        double mean = 0;
        for (double v : profile) mean += v;
        mean /= n;
        double[] centered = new double[n];
        for (int i = 0; i < n; i++) {
            centered[i] = profile[i] - mean;
        }

        double[] cos = new double[n];
        double[] sin = new double[n];
        for (int i = 0; i < n; i++) {
            double angle = 2.0 * Math.PI * i / n;
            cos[i] = Math.cos(angle);
            sin[i] = Math.sin(angle);
        }

        double[] magnitude = new double[n / 2 + 1];
        for (int k = 0; k < magnitude.length; k++) {
            double re = 0;
            double im = 0;
            int phase = 0;
            for (int j = 0; j < n; j++) {
                re += centered[j] * cos[phase];
                im -= centered[j] * sin[phase];
                phase += k;
                if (phase >= n) phase -= n;
            }
            magnitude[k] = Math.sqrt(re * re + im * im);
        }
        return magnitude;
    }
}
