package com.trendscope.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Predicted daily mentions of one entity by one model.
 *
 * <p>
 * Values are never negative: they are clamped at zero on construction.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecastResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entity;
    private final String model;
    private final SortedMap<LocalDate, Double> values;

    public ForecastResult(String entity, String model, Map<LocalDate, Double> values) {
        this.entity = Objects.requireNonNull(entity, "entity must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(values, "values must not be null");
        TreeMap<LocalDate, Double> clamped = new TreeMap<>();
        values.forEach((date, value) -> clamped.put(date, Math.max(0.0, value)));
        this.values = Collections.unmodifiableSortedMap(clamped);
    }

    public static ForecastResult empty(String entity, String model) {
        return new ForecastResult(entity, model, Collections.emptyMap());
    }

    public String getEntity() {
        return entity;
    }

    public String getModel() {
        return model;
    }

    public SortedMap<LocalDate, Double> getValues() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return "ForecastResult{entity='" + entity + "', model='" + model + "', days=" + values.size() + '}';
    }
}
