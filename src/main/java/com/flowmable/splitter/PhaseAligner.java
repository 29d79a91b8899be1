package com.flowmable.splitter;

/**
 * Phase search for a known grid period.
 * <p>
 * Grid lines belong in the gaps between sprites, where foreground density is
 * lowest. Every offset in {@code [0, period)} is scored by the profile mass in a
 * small window around each line position; the lowest score wins, the smallest
 * offset on ties.
 */
public final class PhaseAligner {

    /** Half-width of the window summed around each grid line. */
    public static final int WINDOW = 3;

    private PhaseAligner() {}

    public static int findOffset(double[] profile, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("period must be > 0: " + period);
        }
        int n = profile.length;
        double[] prefix = new double[n + 1];
        for (int i = 0; i < n; i++) {
            prefix[i + 1] = prefix[i] + profile[i];
        }

        int bestOffset = 0;
        double bestScore = Double.POSITIVE_INFINITY;
        for (int offset = 0; offset < period; offset++) {
            double score = 0;
            for (int p = offset; p < n; p += period) {
                int lo = Math.max(0, p - WINDOW);
                int hi = Math.min(n, p + WINDOW + 1);
                score += prefix[hi] - prefix[lo];
            }
            if (score < bestScore) {
                bestScore = score;
                bestOffset = offset;
            }
        }
        return bestOffset;
    }
}
