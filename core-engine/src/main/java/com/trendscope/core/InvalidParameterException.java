package com.trendscope.core;

/**
 * Thrown when a structural analysis parameter is outside its legal range
 * (window sizes below one, non-positive thresholds, an empty scale list and so
 * on).
 *
 * <p>
 * Raised eagerly by constructors and factory methods so that a misconfigured
 * detector fails at build time instead of silently producing meaningless
 * scores.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidParameterException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String parameter;

    public InvalidParameterException(String parameter, String message) {
        super(parameter + " " + message);
        this.parameter = parameter;
    }

    /**
     * @return name of the offending parameter
     */
    public String getParameter() {
        return parameter;
    }

    // ---------------------------------------------------------------
    // Guards
    // ---------------------------------------------------------------

    public static int requireAtLeast(String parameter, int value, int minimum) {
        if (value < minimum) {
            throw new InvalidParameterException(parameter, "must be >= " + minimum + ", got: " + value);
        }
        return value;
    }

    public static double requirePositive(String parameter, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new InvalidParameterException(parameter, "must be > 0, got: " + value);
        }
        return value;
    }

    public static double requireNonNegative(String parameter, double value) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new InvalidParameterException(parameter, "must be >= 0, got: " + value);
        }
        return value;
    }

    public static double requireInRange(String parameter, double value, double lowerExclusive,
            double upperInclusive) {
        if (!(value > lowerExclusive && value <= upperInclusive)) {
            throw new InvalidParameterException(parameter,
                    "must be in (" + lowerExclusive + ", " + upperInclusive + "], got: " + value);
        }
        return value;
    }
}
