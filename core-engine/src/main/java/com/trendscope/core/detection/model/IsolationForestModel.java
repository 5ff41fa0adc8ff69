package com.trendscope.core.detection.model;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.concurrent.Cancellation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import smile.anomaly.IsolationForest;
import smile.math.MathEx;

/**
 * {@link OutlierModel} backed by Smile's {@link IsolationForest}.
 *
 * <p>
 * Each tree is grown on a random {@value #SUBSAMPLE} share of the training
 * rows, at most {@value #MAX_SAMPLES} of them, to a depth of
 * {@code ceil(log2(samples))}. Smile reports the normalised anomaly
 * score {@code 2^(-E[h(x)] / c(n))}, higher meaning more isolated; the
 * decision value is its negation shifted by the contamination percentile of
 * the training scores.
 * </p>
 *
 * @since 1.0.0
 */
public final class IsolationForestModel implements OutlierModel {

    static final int DEFAULT_TREES = 100;
    static final int MAX_SAMPLES = 256;
    static final double SUBSAMPLE = 0.7;

    private final int treeCount;
    private final double contamination;
    private final long seed;

    private IsolationForest forest;
    private int width;
    private double offset;

    public IsolationForestModel(double contamination, long seed) {
        this(DEFAULT_TREES, contamination, seed);
    }

    public IsolationForestModel(int treeCount, double contamination, long seed) {
        this.treeCount = InvalidParameterException.requireAtLeast("treeCount", treeCount, 1);
        this.contamination = InvalidParameterException.requireInRange("contamination", contamination, 0.0, 0.5);
        this.seed = seed;
    }

    @Override
    public void fit(double[][] rows) {
        OutlierModel.checkTrainingRows("Isolation forest", rows);
        Cancellation.checkpoint();
        double subsample = Math.min(SUBSAMPLE, (double) MAX_SAMPLES / rows.length);
        long samples = Math.max(2, Math.round(rows.length * subsample));
        int depth = Math.max(1, (int) Math.ceil(Math.log(samples) / Math.log(2)));

        MathEx.setSeed(seed);
        forest = IsolationForest.fit(rows, treeCount, depth, subsample, 0);
        width = rows[0].length;

        offset = new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(negatedScores(rows), contamination * 100.0);
    }

    @Override
    public double[] decisionFunction(double[][] rows) {
        if (!isFitted()) {
            throw new IllegalStateException("Isolation forest has not been fitted");
        }
        OutlierModel.checkWidth("Isolation forest", width, rows);
        double[] decisions = negatedScores(rows);
        for (int i = 0; i < decisions.length; i++) {
            decisions[i] -= offset;
        }
        return decisions;
    }

    @Override
    public boolean isFitted() {
        return forest != null;
    }

    @Override
    public int featureCount() {
        return width;
    }

    /** Lower means more abnormal. */
    private double[] negatedScores(double[][] rows) {
        double[] scores = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            scores[i] = -forest.score(rows[i]);
        }
        return scores;
    }
}
