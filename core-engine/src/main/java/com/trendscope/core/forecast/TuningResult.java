package com.trendscope.core.forecast;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tuned models by name, and the one with the lowest cross-validated MSE.
 *
 * @since 1.0.0
 */
public final class TuningResult {

    private final Map<String, TunedModel> models;

    TuningResult(Map<String, TunedModel> models) {
        this.models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
    }

    public Map<String, TunedModel> getModels() {
        return models;
    }

    /**
     * @return the model with the lowest MSE, the first one on ties, or empty
     *         when nothing could be tuned
     */
    public Optional<TunedModel> getBest() {
        return models.values().stream().min(Comparator.comparingDouble(TunedModel::getMse));
    }

    public boolean isEmpty() {
        return models.isEmpty();
    }
}
