package com.trendscope.core.forecast;

import com.trendscope.core.forecast.model.Regressor;

import java.util.Arrays;

/**
 * Forecasts with a regressor trained on {@link LagFeatures}.
 *
 * <p>
 * Prediction is recursive: each forecast day is appended to the recent
 * window and becomes lag 1 of the next day. Predictions are clamped at zero
 * before they are fed back.
 * </p>
 *
 * @since 1.0.0
 */
abstract class LagRegressionForecaster extends AbstractForecaster {

    /** Fewest lag rows a regressor is trained on. */
    static final int MIN_TRAINING_ROWS = 10;

    @Override
    protected double[] extrapolate(double[] values, int horizon) {
        LagFeatures features = LagFeatures.of(values);
        if (features.size() < MIN_TRAINING_ROWS) {
            throw insufficient(MIN_TRAINING_ROWS + LagFeatures.MAX_LAG, values.length);
        }
        Regressor regressor = newRegressor();
        regressor.fit(features.rows(), features.targets());

        double[] recent = Arrays.copyOfRange(values, values.length - LagFeatures.MAX_LAG, values.length);
        double[] predictions = new double[horizon];
        for (int h = 0; h < horizon; h++) {
            double next = Math.max(0.0, regressor.predict(LagFeatures.nextRow(recent)));
            predictions[h] = next;
            System.arraycopy(recent, 1, recent, 0, recent.length - 1);
            recent[recent.length - 1] = next;
        }
        return predictions;
    }

    /** A fresh, unfitted regressor for one forecast. */
    protected abstract Regressor newRegressor();
}
