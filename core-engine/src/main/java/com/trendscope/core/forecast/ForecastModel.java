package com.trendscope.core.forecast;

import java.util.Objects;

/**
 * The forecasting strategies the ensemble can run, with their configuration
 * tags.
 *
 * @since 1.0.0
 */
public enum ForecastModel {

    ARIMA("arima") {
        @Override
        public Forecaster newForecaster() {
            return new ArimaForecaster();
        }
    },
    EXPONENTIAL_SMOOTHING("exponential_smoothing") {
        @Override
        public Forecaster newForecaster() {
            return new ExponentialSmoothingForecaster();
        }
    },
    LINEAR_REGRESSION("linear_regression") {
        @Override
        public Forecaster newForecaster() {
            return new LinearTrendForecaster();
        }
    },
    RANDOM_FOREST("random_forest") {
        @Override
        public Forecaster newForecaster() {
            return new TreeEnsembleForecaster();
        }
    },
    SVR("svr") {
        @Override
        public Forecaster newForecaster() {
            return new KernelSvrForecaster();
        }
    };

    private final String tag;

    ForecastModel(String tag) {
        this.tag = tag;
    }

    /**
     * @return a forecaster of this kind with its default parameters
     */
    public abstract Forecaster newForecaster();

    public String getTag() {
        return tag;
    }

    /**
     * Resolve a configuration tag, case-insensitively.
     *
     * @throws IllegalArgumentException if no model has that tag
     */
    public static ForecastModel fromTag(String tag) {
        Objects.requireNonNull(tag, "forecast model tag must not be null");
        for (ForecastModel model : values()) {
            if (model.tag.equalsIgnoreCase(tag.trim())) {
                return model;
            }
        }
        throw new IllegalArgumentException("Unknown forecast model '" + tag + "'");
    }

    @Override
    public String toString() {
        return tag;
    }
}
