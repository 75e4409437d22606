package org.carma.q2s.mechanism;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Half-up decimal rounding used to keep matrix and margin values stable for display
 * and for exact comparisons in reports.
 */
public final class Rounding {

    /** Scale of satisfaction distances, AvgSat and Score. */
    public static final int DISTANCE_SCALE = 3;

    /** Scale of perturbation margins. */
    public static final int MARGIN_SCALE = 4;

    /** Scale value that disables rounding. */
    public static final int NONE = -1;

    private Rounding() {}

    /**
     * Round to {@code scale} decimal places; a negative scale or a non-finite
     * value returns the input unchanged.
     */
    public static double round(double value, int scale) {
        if (scale < 0 || !Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * {@code numerator / denominator} computed in decimal and rounded to {@code scale}.
     */
    public static double divide(double numerator, double denominator, int scale) {
        if (scale < 0 || !Double.isFinite(numerator) || !Double.isFinite(denominator)) {
            return numerator / denominator;
        }
        return BigDecimal.valueOf(numerator)
            .divide(BigDecimal.valueOf(denominator), scale, RoundingMode.HALF_UP)
            .doubleValue();
    }

    /**
     * Arithmetic mean computed in decimal and rounded to {@code scale}.
     *
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static double mean(Collection<Double> values, int scale) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Cannot average an empty collection");
        }
        if (scale < 0) {
            double sum = 0.0;
            for (double v : values) {
                sum += v;
            }
            return sum / values.size();
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (double v : values) {
            sum = sum.add(BigDecimal.valueOf(v));
        }
        return sum.divide(BigDecimal.valueOf(values.size()), scale, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * {@code weight * a + (1 - weight) * b} computed in decimal and rounded to {@code scale}.
     */
    public static double blend(double weight, double a, double b, int scale) {
        if (scale < 0) {
            return weight * a + (1.0 - weight) * b;
        }
        BigDecimal w = BigDecimal.valueOf(weight);
        return w.multiply(BigDecimal.valueOf(a))
            .add(BigDecimal.ONE.subtract(w).multiply(BigDecimal.valueOf(b)))
            .setScale(scale, RoundingMode.HALF_UP)
            .doubleValue();
    }
}
