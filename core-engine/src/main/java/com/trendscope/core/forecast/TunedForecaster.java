package com.trendscope.core.forecast;

import com.trendscope.core.forecast.model.Regressor;

/**
 * Lag-feature forecaster driven by a {@link TunedModel}.
 */
class TunedForecaster extends LagRegressionForecaster {

    private final TunedModel tuned;

    TunedForecaster(TunedModel tuned) {
        this.tuned = tuned;
    }

    @Override
    protected Regressor newRegressor() {
        return tuned.newRegressor();
    }

    @Override
    public ForecastModel model() {
        return tuned.getFamily();
    }
}
