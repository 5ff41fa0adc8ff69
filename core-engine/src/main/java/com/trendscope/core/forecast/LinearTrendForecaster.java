package com.trendscope.core.forecast;

import com.trendscope.core.concurrent.Cancellation;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Straight-line fit of the daily value against the day index, extended past
 * the last day.
 *
 * @since 1.0.0
 */
public class LinearTrendForecaster extends AbstractForecaster {

    @Override
    protected double[] extrapolate(double[] values, int horizon) {
        if (values.length < 2) {
            throw insufficient(2, values.length);
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < values.length; i++) {
            Cancellation.checkpoint();
            regression.addData(i, values[i]);
        }
        double[] predictions = new double[horizon];
        for (int h = 0; h < horizon; h++) {
            Cancellation.checkpoint();
            predictions[h] = regression.predict(values.length + h);
        }
        return predictions;
    }

    @Override
    public ForecastModel model() {
        return ForecastModel.LINEAR_REGRESSION;
    }
}
