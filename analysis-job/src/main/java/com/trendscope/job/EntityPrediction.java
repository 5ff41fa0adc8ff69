package com.trendscope.job;

import com.trendscope.core.forecast.EntityForecast;
import com.trendscope.core.forecast.EventPredictionReport;

import java.util.Objects;

/**
 * Mention forecast and predicted events of one entity, as written to
 * {@code predictions.json}.
 *
 * @since 1.0.0
 */
public final class EntityPrediction {

    private final EntityForecast forecast;
    private final EventPredictionReport events;

    public EntityPrediction(EntityForecast forecast, EventPredictionReport events) {
        this.forecast = Objects.requireNonNull(forecast, "forecast must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
    }

    public EntityForecast getForecast() {
        return forecast;
    }

    public EventPredictionReport getEvents() {
        return events;
    }
}
