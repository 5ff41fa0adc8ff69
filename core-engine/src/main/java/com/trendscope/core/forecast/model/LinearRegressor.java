package com.trendscope.core.forecast.model;

import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

/**
 * Ordinary least squares with an intercept.
 *
 * @since 1.0.0
 */
public final class LinearRegressor implements Regressor {

    private double[] coefficients;

    @Override
    public void fit(double[][] rows, double[] targets) {
        Regressor.checkShape(rows, targets);
        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
        ols.newSampleData(targets, rows);
        coefficients = ols.estimateRegressionParameters();
    }

    @Override
    public double predict(double[] row) {
        if (coefficients == null) {
            throw new IllegalStateException("Linear regressor has not been fitted");
        }
        double value = coefficients[0];
        for (int f = 0; f < row.length; f++) {
            value += coefficients[f + 1] * row[f];
        }
        return value;
    }
}
