package com.trendscope.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Burst scores of one day computed at several baseline window sizes.
 *
 * @since 1.0.0
 */
public final class MultiScaleBurst implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDate date;
    private final double value;
    private final Map<Integer, Double> scaleScores;
    private final Map<Integer, Boolean> scaleFlags;

    public MultiScaleBurst(LocalDate date, double value, Map<Integer, Double> scaleScores,
            Map<Integer, Boolean> scaleFlags) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.value = value;
        this.scaleScores = new LinkedHashMap<>(scaleScores);
        this.scaleFlags = new LinkedHashMap<>(scaleFlags);
    }

    public LocalDate getDate() {
        return date;
    }

    public double getValue() {
        return value;
    }

    public Map<Integer, Double> getScaleScores() {
        return Collections.unmodifiableMap(scaleScores);
    }

    public Map<Integer, Boolean> getScaleFlags() {
        return Collections.unmodifiableMap(scaleFlags);
    }

    /**
     * @return mean of the per-scale scores
     */
    public double getCombinedScore() {
        return scaleScores.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    /**
     * @return {@code true} when at least one scale flagged the day
     */
    public boolean isBurst() {
        return scaleFlags.containsValue(Boolean.TRUE);
    }

    @Override
    public String toString() {
        return "MultiScaleBurst{date=" + date + ", value=" + value + ", scores=" + scaleScores + '}';
    }
}
