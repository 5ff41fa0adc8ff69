package com.trendscope.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Correlation between the mention series of two entities.
 *
 * <p>
 * {@code lag} is {@code null} for a static correlation. For a lagged one a
 * positive lag {@code k} means {@code entity1} leads {@code entity2} by
 * {@code k} days; a negative lag means {@code entity2} leads.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationResult implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Returned when there is not enough overlapping data to say anything. */
    public static final double NO_EVIDENCE_P_VALUE = 1.0;

    private final String entity1;
    private final String entity2;
    private final double correlation;
    private final double pValue;
    private final Integer lag;

    public CorrelationResult(String entity1, String entity2, double correlation, double pValue, Integer lag) {
        this.entity1 = Objects.requireNonNull(entity1, "entity1 must not be null");
        this.entity2 = Objects.requireNonNull(entity2, "entity2 must not be null");
        if (correlation < -1.0 || correlation > 1.0 || Double.isNaN(correlation)) {
            throw new IllegalArgumentException("correlation must be in [-1, 1], got: " + correlation);
        }
        this.correlation = correlation;
        this.pValue = pValue;
        this.lag = lag;
    }

    public static CorrelationResult noEvidence(String entity1, String entity2) {
        return new CorrelationResult(entity1, entity2, 0.0, NO_EVIDENCE_P_VALUE, null);
    }

    public String getEntity1() {
        return entity1;
    }

    public String getEntity2() {
        return entity2;
    }

    public double getCorrelation() {
        return correlation;
    }

    public double getPValue() {
        return pValue;
    }

    public Integer getLag() {
        return lag;
    }

    public boolean hasLag() {
        return lag != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CorrelationResult that))
            return false;
        return Double.compare(correlation, that.correlation) == 0
                && Double.compare(pValue, that.pValue) == 0
                && entity1.equals(that.entity1)
                && entity2.equals(that.entity2)
                && Objects.equals(lag, that.lag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity1, entity2, correlation, pValue, lag);
    }

    @Override
    public String toString() {
        return "CorrelationResult{" +
                entity1 + " ~ " + entity2 +
                ", r=" + correlation +
                ", p=" + pValue +
                (lag != null ? ", lag=" + lag : "") +
                '}';
    }
}
