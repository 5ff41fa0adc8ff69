package com.trendscope.core.forecast;

import com.trendscope.core.forecast.model.Regressor;
import com.trendscope.core.forecast.model.SupportVectorRegressor;

/**
 * RBF support vector regression on lag features.
 *
 * @since 1.0.0
 */
public class KernelSvrForecaster extends LagRegressionForecaster {

    @Override
    protected Regressor newRegressor() {
        return new SupportVectorRegressor();
    }

    @Override
    public ForecastModel model() {
        return ForecastModel.SVR;
    }
}
