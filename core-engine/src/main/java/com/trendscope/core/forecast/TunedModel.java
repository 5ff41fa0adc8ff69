package com.trendscope.core.forecast;

import com.trendscope.core.forecast.model.Regressor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Best parameter set found for one regressor, with its cross-validated
 * error.
 *
 * @since 1.0.0
 */
public final class TunedModel {

    private final String name;
    private final ForecastModel family;
    private final Map<String, Object> params;
    private final double mse;
    private final Supplier<Regressor> factory;

    TunedModel(String name, ForecastModel family, Map<String, Object> params, double mse,
            Supplier<Regressor> factory) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.family = Objects.requireNonNull(family, "family must not be null");
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.mse = mse;
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    public String getName() {
        return name;
    }

    /** Forecast model whose results this regressor stands in for. */
    public ForecastModel getFamily() {
        return family;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    /** Mean squared error averaged over the cross-validation folds. */
    public double getMse() {
        return mse;
    }

    /** A fresh, unfitted regressor with the tuned parameters. */
    public Regressor newRegressor() {
        return factory.get();
    }

    @Override
    public String toString() {
        return "TunedModel{name='" + name + "', params=" + params + ", mse=" + mse + '}';
    }
}
