package com.trendscope.core.forecast;

import com.trendscope.core.model.PredictedEvent;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Predicted events of one entity over its forecast window.
 *
 * @since 1.0.0
 */
public final class EventPredictionReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entity;
    private final LocalDate predictionStart;
    private final LocalDate predictionEnd;
    private final double eventThreshold;
    private final List<PredictedEvent> predictedEvents;

    /**
     * @param predictionStart first forecast day, {@code null} when no forecast
     *                        was available
     * @param predictionEnd   last forecast day, {@code null} when no forecast
     *                        was available
     */
    public EventPredictionReport(String entity, LocalDate predictionStart, LocalDate predictionEnd,
            double eventThreshold, List<PredictedEvent> predictedEvents) {
        this.entity = Objects.requireNonNull(entity, "entity must not be null");
        this.predictionStart = predictionStart;
        this.predictionEnd = predictionEnd;
        this.eventThreshold = eventThreshold;
        this.predictedEvents = List.copyOf(predictedEvents);
    }

    public String getEntity() {
        return entity;
    }

    public LocalDate getPredictionStart() {
        return predictionStart;
    }

    public LocalDate getPredictionEnd() {
        return predictionEnd;
    }

    public double getEventThreshold() {
        return eventThreshold;
    }

    public List<PredictedEvent> getPredictedEvents() {
        return predictedEvents;
    }

    @Override
    public String toString() {
        return "EventPredictionReport{entity='" + entity + "', window=" + predictionStart + ".." + predictionEnd
                + ", events=" + predictedEvents.size() + '}';
    }
}
