package com.trendscope.core.forecast.model;

import com.trendscope.core.InvalidParameterException;
import smile.data.DataFrame;
import smile.regression.ElasticNet;
import smile.regression.LASSO;
import smile.regression.LinearModel;
import smile.regression.RidgeRegression;

/**
 * Regularized least squares with an intercept: ridge, lasso or elastic net,
 * trained by Smile.
 *
 * <p>
 * The elastic net splits {@code alpha} into an L1 weight
 * {@code alpha * l1Ratio} and an L2 weight {@code alpha * (1 - l1Ratio)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class PenalizedRegressor implements Regressor {

    public enum Penalty {
        RIDGE,
        LASSO,
        ELASTIC_NET
    }

    private final Penalty penalty;
    private final double alpha;
    private final double l1Ratio;
    private LinearModel model;
    private int width;

    private PenalizedRegressor(Penalty penalty, double alpha, double l1Ratio) {
        this.penalty = penalty;
        this.alpha = InvalidParameterException.requirePositive("alpha", alpha);
        this.l1Ratio = l1Ratio;
    }

    public static PenalizedRegressor ridge(double alpha) {
        return new PenalizedRegressor(Penalty.RIDGE, alpha, 0.0);
    }

    public static PenalizedRegressor lasso(double alpha) {
        return new PenalizedRegressor(Penalty.LASSO, alpha, 1.0);
    }

    /**
     * @param l1Ratio share of the penalty on the absolute coefficients, in
     *                (0, 1)
     */
    public static PenalizedRegressor elasticNet(double alpha, double l1Ratio) {
        if (!(l1Ratio > 0.0 && l1Ratio < 1.0)) {
            throw new InvalidParameterException("l1Ratio", "must be in (0, 1), got: " + l1Ratio);
        }
        return new PenalizedRegressor(Penalty.ELASTIC_NET, alpha, l1Ratio);
    }

    @Override
    public void fit(double[][] rows, double[] targets) {
        Regressor.checkShape(rows, targets);
        DataFrame frame = SmileFrames.of(rows, targets);
        switch (penalty) {
            case RIDGE -> model = RidgeRegression.fit(SmileFrames.FORMULA, frame, alpha);
            case LASSO -> model = LASSO.fit(SmileFrames.FORMULA, frame, alpha);
            case ELASTIC_NET -> model = ElasticNet.fit(SmileFrames.FORMULA, frame, alpha * l1Ratio,
                    alpha * (1.0 - l1Ratio));
            default -> throw new IllegalStateException("Unhandled penalty " + penalty);
        }
        width = rows[0].length;
    }

    @Override
    public double predict(double[] row) {
        if (model == null) {
            throw new IllegalStateException("Penalized regressor has not been fitted");
        }
        Regressor.checkWidth(width, row);
        return model.predict(SmileFrames.row(row));
    }

    public Penalty getPenalty() {
        return penalty;
    }

    public double getAlpha() {
        return alpha;
    }
}
