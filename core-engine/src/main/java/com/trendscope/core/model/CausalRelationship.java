package com.trendscope.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Directed lead/lag association: mentions of {@code cause} tend to be
 * followed by mentions of {@code effect} {@code lag} days later.
 *
 * <p>
 * This is a statistical association only, not causal proof.
 * </p>
 *
 * @since 1.0.0
 */
public final class CausalRelationship implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String cause;
    private final String effect;
    private final int lag;
    private final double correlation;
    private final double pValue;

    public CausalRelationship(String cause, String effect, int lag, double correlation, double pValue) {
        this.cause = Objects.requireNonNull(cause, "cause must not be null");
        this.effect = Objects.requireNonNull(effect, "effect must not be null");
        if (lag <= 0) {
            throw new IllegalArgumentException("lag must be > 0, got: " + lag);
        }
        this.lag = lag;
        this.correlation = correlation;
        this.pValue = pValue;
    }

    public String getCause() {
        return cause;
    }

    public String getEffect() {
        return effect;
    }

    public int getLag() {
        return lag;
    }

    public double getCorrelation() {
        return correlation;
    }

    public double getPValue() {
        return pValue;
    }

    @Override
    public String toString() {
        return "CausalRelationship{" + cause + " -> " + effect + ", lag=" + lag
                + ", r=" + correlation + ", p=" + pValue + '}';
    }
}
