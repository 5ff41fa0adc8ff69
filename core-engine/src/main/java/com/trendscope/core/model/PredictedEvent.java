package com.trendscope.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A future day on which the ensemble forecast peaks above the event
 * threshold.
 *
 * @since 1.0.0
 */
public final class PredictedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entity;
    private final LocalDate date;
    private final double predictedValue;
    private final double confidence;

    public PredictedEvent(String entity, LocalDate date, double predictedValue, double confidence) {
        this.entity = Objects.requireNonNull(entity, "entity must not be null");
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.predictedValue = predictedValue;
        this.confidence = confidence;
    }

    /**
     * Confidence of an event: the predicted value relative to twice the
     * threshold, capped at one.
     */
    public static double confidence(double predictedValue, double threshold) {
        return Math.min(1.0, predictedValue / (2.0 * threshold));
    }

    public String getEntity() {
        return entity;
    }

    public LocalDate getDate() {
        return date;
    }

    public double getPredictedValue() {
        return predictedValue;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return "PredictedEvent{entity='" + entity + "', date=" + date + ", value=" + predictedValue
                + ", confidence=" + confidence + '}';
    }
}
