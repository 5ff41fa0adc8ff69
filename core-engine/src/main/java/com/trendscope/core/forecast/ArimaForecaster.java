package com.trendscope.core.forecast;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.concurrent.Cancellation;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

/**
 * ARIMA({@code p},1,0): an autoregression of order {@code p} on the first
 * differences, without a constant term.
 *
 * <p>
 * Coefficients are the least-squares fit of each difference on its
 * {@code p} predecessors. Forecast differences are generated recursively and
 * integrated back onto the last observed value.
 * </p>
 *
 * @since 1.0.0
 */
public class ArimaForecaster extends AbstractForecaster {

    public static final int DEFAULT_ORDER = 5;

    private final int order;

    public ArimaForecaster() {
        this(DEFAULT_ORDER);
    }

    public ArimaForecaster(int order) {
        this.order = InvalidParameterException.requireAtLeast("order", order, 1);
    }

    @Override
    protected double[] extrapolate(double[] values, int horizon) {
        int n = values.length;
        double[] diffs = new double[n - 1];
        for (int t = 1; t < n; t++) {
            diffs[t - 1] = values[t] - values[t - 1];
        }
        int rowCount = diffs.length - order;
        // OLS needs more observations than coefficients
        if (rowCount <= order) {
            throw insufficient(2 * order + 2, n);
        }

        double[][] rows = new double[rowCount][order];
        double[] targets = new double[rowCount];
        for (int k = 0; k < rowCount; k++) {
            Cancellation.checkpoint();
            int t = k + order;
            for (int lag = 1; lag <= order; lag++) {
                rows[k][lag - 1] = diffs[t - lag];
            }
            targets[k] = diffs[t];
        }

        double[] phi;
        Cancellation.checkpoint();
        try {
            OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
            ols.setNoIntercept(true);
            ols.newSampleData(targets, rows);
            phi = ols.estimateRegressionParameters();
        } catch (MathIllegalArgumentException e) {
            throw new ForecastException(model(), "autoregression fit failed: " + e.getMessage(), e);
        }

        double[] recent = new double[order + horizon];
        System.arraycopy(diffs, diffs.length - order, recent, 0, order);
        double level = values[n - 1];
        double[] predictions = new double[horizon];
        for (int h = 0; h < horizon; h++) {
            Cancellation.checkpoint();
            int t = order + h;
            double next = 0;
            for (int lag = 1; lag <= order; lag++) {
                next += phi[lag - 1] * recent[t - lag];
            }
            recent[t] = next;
            level += next;
            predictions[h] = level;
        }
        return predictions;
    }

    @Override
    public ForecastModel model() {
        return ForecastModel.ARIMA;
    }

    public int getOrder() {
        return order;
    }
}
