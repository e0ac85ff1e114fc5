package org.nowstart.edgeguard.util;

/**
 * Division and finiteness guards shared by metrics, filters and ensemble voting.
 *
 * <p>None of these helpers throw or return {@code NaN}; a degenerate denominator resolves
 * to the caller supplied fallback (or {@code 0}).
 */
public final class NumericSafety {

    private NumericSafety() {
    }

    public static double safeRatio(double numerator, double denominator) {
        return safeRatio(numerator, denominator, 0.0);
    }

    public static double safeRatio(double numerator, double denominator, double fallback) {
        if (!Double.isFinite(numerator) || !Double.isFinite(denominator) || denominator == 0.0) {
            return fallback;
        }
        double result = numerator / denominator;
        return Double.isFinite(result) ? result : fallback;
    }

    /**
     * Returns {@code (part / whole) * 100}, or {@code 0} when {@code whole} is zero or non-finite.
     */
    public static double safePercent(double part, double whole) {
        return safeRatio(part, whole) * 100.0;
    }

    public static double finiteOr(double value, double fallback) {
        return Double.isFinite(value) ? value : fallback;
    }

    public static double sanitizeForLog(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
