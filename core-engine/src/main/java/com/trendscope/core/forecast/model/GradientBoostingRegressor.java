package com.trendscope.core.forecast.model;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.concurrent.Cancellation;
import smile.base.cart.Loss;
import smile.math.MathEx;
import smile.regression.GradientTreeBoost;

/**
 * Least-squares gradient tree boosting, trained by Smile's
 * {@link GradientTreeBoost}. Smile's generator is seeded before each fit so
 * the row subsampling repeats.
 *
 * @since 1.0.0
 */
public final class GradientBoostingRegressor implements Regressor {

    private final int treeCount;
    private final double learningRate;
    private final int maxDepth;
    private final int nodeSize;
    private final double subsample;
    private final long seed;
    private GradientTreeBoost model;
    private int width;

    /**
     * @param subsample share of rows each tree is grown on, in (0, 1]
     */
    public GradientBoostingRegressor(int treeCount, double learningRate, int maxDepth, int nodeSize,
            double subsample, long seed) {
        this.treeCount = InvalidParameterException.requireAtLeast("treeCount", treeCount, 1);
        this.learningRate = InvalidParameterException.requireInRange("learningRate", learningRate, 0.0, 1.0);
        this.maxDepth = InvalidParameterException.requireAtLeast("maxDepth", maxDepth, 2);
        this.nodeSize = InvalidParameterException.requireAtLeast("nodeSize", nodeSize, 2);
        this.subsample = InvalidParameterException.requireInRange("subsample", subsample, 0.0, 1.0);
        this.seed = seed;
    }

    @Override
    public void fit(double[][] rows, double[] targets) {
        Regressor.checkShape(rows, targets);
        Cancellation.checkpoint();
        MathEx.setSeed(seed);
        model = GradientTreeBoost.fit(SmileFrames.FORMULA, SmileFrames.of(rows, targets), Loss.ls(), treeCount,
                maxDepth, Math.max(2, rows.length), nodeSize, learningRate, subsample);
        width = rows[0].length;
    }

    @Override
    public double predict(double[] row) {
        if (model == null) {
            throw new IllegalStateException("Gradient boosting regressor has not been fitted");
        }
        Regressor.checkWidth(width, row);
        return model.predict(SmileFrames.row(row));
    }

    public int getTreeCount() {
        return treeCount;
    }
}
