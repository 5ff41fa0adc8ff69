package com.trendscope.core.forecast;

/**
 * Lagged feature rows for the regression forecasters.
 *
 * <p>
 * Row {@code t} holds the values at {@code t-1}, {@code t-2}, {@code t-3} and
 * {@code t-7}; its target is the value at {@code t}. The first
 * {@value #MAX_LAG} days have no complete row and are dropped.
 * </p>
 *
 * @since 1.0.0
 */
public final class LagFeatures {

    static final int[] LAGS = {1, 2, 3, 7};
    static final int MAX_LAG = 7;

    private final double[][] rows;
    private final double[] targets;

    private LagFeatures(double[][] rows, double[] targets) {
        this.rows = rows;
        this.targets = targets;
    }

    public static LagFeatures of(double[] values) {
        int count = Math.max(0, values.length - MAX_LAG);
        double[][] rows = new double[count][];
        double[] targets = new double[count];
        for (int k = 0; k < count; k++) {
            int t = k + MAX_LAG;
            rows[k] = rowAt(values, t);
            targets[k] = values[t];
        }
        return new LagFeatures(rows, targets);
    }

    /**
     * Feature row for the day after {@code recent}'s last value. Lags that
     * reach before the start of {@code recent} are zero.
     */
    static double[] nextRow(double[] recent) {
        return rowAt(recent, recent.length);
    }

    private static double[] rowAt(double[] values, int t) {
        double[] row = new double[LAGS.length];
        for (int f = 0; f < LAGS.length; f++) {
            int source = t - LAGS[f];
            row[f] = source >= 0 ? values[source] : 0.0;
        }
        return row;
    }

    public double[][] rows() {
        return rows;
    }

    public double[] targets() {
        return targets;
    }

    public int size() {
        return targets.length;
    }

    /** Rows {@code [from, to)}. */
    public double[][] rows(int from, int to) {
        double[][] slice = new double[to - from][];
        System.arraycopy(rows, from, slice, 0, to - from);
        return slice;
    }

    /** Targets {@code [from, to)}. */
    public double[] targets(int from, int to) {
        double[] slice = new double[to - from];
        System.arraycopy(targets, from, slice, 0, to - from);
        return slice;
    }
}
