package com.trendscope.core.forecast;

import com.trendscope.core.forecast.model.RandomForestRegressor;
import com.trendscope.core.forecast.model.Regressor;

/**
 * Random forest on lag features.
 *
 * @since 1.0.0
 */
public class TreeEnsembleForecaster extends LagRegressionForecaster {

    public static final long RANDOM_SEED = 42L;

    @Override
    protected Regressor newRegressor() {
        return new RandomForestRegressor(RANDOM_SEED);
    }

    @Override
    public ForecastModel model() {
        return ForecastModel.RANDOM_FOREST;
    }
}
