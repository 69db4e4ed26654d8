package net.deckadvisor.util;

/**
 * Arithmetic helpers for the [0, 1] scores carried on recommendations.
 */
public final class ScoreUtils {

    private static final double ROUNDING_SCALE = 1_000_000d;

    private ScoreUtils() {
    }

    /**
     * Clamps a score into [0, 1]. NaN becomes 0.
     */
    public static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0d;
        }
        return Math.max(0d, Math.min(1d, value));
    }

    /**
     * Rounds to six decimals so sums like {@code 0.15 + 0.15} compare equal to {@code 0.3}.
     */
    public static double round(double value) {
        return Math.round(value * ROUNDING_SCALE) / ROUNDING_SCALE;
    }

    /**
     * Ratio of {@code part} to {@code total}; 0 when the total is not positive.
     */
    public static double ratio(double part, double total) {
        return total > 0 ? part / total : 0d;
    }
}
