package com.trendscope.core.forecast.model;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.concurrent.Cancellation;
import smile.regression.RandomForest;

import java.util.stream.LongStream;

/**
 * Smile {@link RandomForest} regression over feature rows.
 *
 * <p>
 * Every tree is grown on a bootstrap sample and considers all features at
 * each split, so trees differ only by their sample. Tree {@code t} is seeded
 * with {@code seed + t}, which makes fits reproducible.
 * </p>
 *
 * @since 1.0.0
 */
public final class RandomForestRegressor implements Regressor {

    public static final int DEFAULT_TREES = 100;
    public static final int DEFAULT_MAX_DEPTH = 10;
    public static final int DEFAULT_NODE_SIZE = 2;

    private final int treeCount;
    private final int maxDepth;
    private final int nodeSize;
    private final long seed;
    private RandomForest forest;
    private int width;

    public RandomForestRegressor(long seed) {
        this(DEFAULT_TREES, DEFAULT_MAX_DEPTH, DEFAULT_NODE_SIZE, seed);
    }

    /**
     * @param nodeSize fewest rows a node must hold to be split further
     */
    public RandomForestRegressor(int treeCount, int maxDepth, int nodeSize, long seed) {
        this.treeCount = InvalidParameterException.requireAtLeast("treeCount", treeCount, 1);
        this.maxDepth = InvalidParameterException.requireAtLeast("maxDepth", maxDepth, 2);
        this.nodeSize = InvalidParameterException.requireAtLeast("nodeSize", nodeSize, 2);
        this.seed = seed;
    }

    @Override
    public void fit(double[][] rows, double[] targets) {
        Regressor.checkShape(rows, targets);
        Cancellation.checkpoint();
        width = rows[0].length;
        int maxNodes = Math.max(2, rows.length);
        forest = RandomForest.fit(SmileFrames.FORMULA, SmileFrames.of(rows, targets), treeCount, width, maxDepth,
                maxNodes, nodeSize, 1.0, LongStream.range(seed, seed + treeCount));
    }

    @Override
    public double predict(double[] row) {
        if (forest == null) {
            throw new IllegalStateException("Random forest has not been fitted");
        }
        Regressor.checkWidth(width, row);
        return forest.predict(SmileFrames.row(row));
    }

    public int getTreeCount() {
        return treeCount;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getNodeSize() {
        return nodeSize;
    }
}
