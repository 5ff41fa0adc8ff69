package com.trendscope.core.config;

import com.trendscope.core.correlation.CorrelationMethod;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Settings of the correlation analyzer.
 *
 * @since 1.0.0
 */
public class CorrelationSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** {@code pearson} or {@code spearman}. */
    private String method = "pearson";

    private double minCorrelation = 0.5;

    /** Overlapping days required before a correlation is computed at all. */
    private int minDataPoints = 10;

    private int maxLag = 7;
    private double significanceThreshold = 0.05;
    private boolean significantOnly = true;

    /**
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (method == null || method.isBlank()) {
            errors.add("'method' is required");
        } else {
            try {
                CorrelationMethod.fromTag(method);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        if (!(minCorrelation >= 0 && minCorrelation <= 1)) {
            errors.add("'minCorrelation' must be in [0, 1], got: " + minCorrelation);
        }
        if (minDataPoints < 3) {
            errors.add("'minDataPoints' must be >= 3, got: " + minDataPoints);
        }
        if (maxLag < 0) {
            errors.add("'maxLag' must be >= 0, got: " + maxLag);
        }
        if (!(significanceThreshold > 0 && significanceThreshold <= 1)) {
            errors.add("'significanceThreshold' must be in (0, 1], got: " + significanceThreshold);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid correlation settings: " + String.join("; ", errors));
        }
    }

    public CorrelationMethod correlationMethod() {
        return CorrelationMethod.fromTag(method);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method != null ? method.toLowerCase(Locale.ROOT) : null;
    }

    public double getMinCorrelation() {
        return minCorrelation;
    }

    public void setMinCorrelation(double minCorrelation) {
        this.minCorrelation = minCorrelation;
    }

    public int getMinDataPoints() {
        return minDataPoints;
    }

    public void setMinDataPoints(int minDataPoints) {
        this.minDataPoints = minDataPoints;
    }

    public int getMaxLag() {
        return maxLag;
    }

    public void setMaxLag(int maxLag) {
        this.maxLag = maxLag;
    }

    public double getSignificanceThreshold() {
        return significanceThreshold;
    }

    public void setSignificanceThreshold(double significanceThreshold) {
        this.significanceThreshold = significanceThreshold;
    }

    public boolean isSignificantOnly() {
        return significantOnly;
    }

    public void setSignificantOnly(boolean significantOnly) {
        this.significantOnly = significantOnly;
    }

    @Override
    public String toString() {
        return "CorrelationSettings{" +
                "method='" + method + '\'' +
                ", minCorrelation=" + minCorrelation +
                ", minDataPoints=" + minDataPoints +
                ", maxLag=" + maxLag +
                ", significanceThreshold=" + significanceThreshold +
                ", significantOnly=" + significantOnly +
                '}';
    }
}
