package com.trendscope.core.correlation;

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;

import java.util.Locale;

/**
 * Correlation coefficient used by {@link CorrelationAnalyzer}.
 *
 * @since 1.0.0
 */
public enum CorrelationMethod {

    PEARSON("pearson") {
        @Override
        public double coefficient(double[] x, double[] y) {
            return new PearsonsCorrelation().correlation(x, y);
        }
    },

    /** Pearson correlation of the ranks, ties sharing their average rank. */
    SPEARMAN("spearman") {
        @Override
        public double coefficient(double[] x, double[] y) {
            return new SpearmansCorrelation().correlation(x, y);
        }
    };

    private final String tag;

    CorrelationMethod(String tag) {
        this.tag = tag;
    }

    /**
     * @return the coefficient of two equally long samples; {@code NaN} when
     *         either sample is constant
     */
    public abstract double coefficient(double[] x, double[] y);

    public String getTag() {
        return tag;
    }

    /**
     * Resolve a configuration tag, ignoring case.
     *
     * @throws IllegalArgumentException if the tag names no method
     */
    public static CorrelationMethod fromTag(String tag) {
        if (tag != null) {
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            for (CorrelationMethod method : values()) {
                if (method.tag.equals(normalized)) {
                    return method;
                }
            }
        }
        throw new IllegalArgumentException(
                "Unknown correlation method: '" + tag + "'. Supported methods: pearson, spearman");
    }

    @Override
    public String toString() {
        return tag;
    }
}
