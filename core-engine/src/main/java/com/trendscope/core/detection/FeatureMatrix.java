package com.trendscope.core.detection;

import com.trendscope.core.model.EntityTimeSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Feature rows the model-based anomaly strategies train on.
 *
 * <p>
 * Columns, in order: the value itself, lags 1, 2, 3 and 7 (each only when the
 * series is longer than the lag), the 7-day inclusive rolling mean and sample
 * standard deviation (only for series longer than 7 days) and the day of the
 * week. Leading days whose lags are undefined produce no row, so row
 * {@code r} describes series day {@link #seriesIndex(int)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureMatrix {

    static final int[] LAGS = { 1, 2, 3, 7 };
    static final int ROLLING_WINDOW = 7;

    private final int firstIndex;
    private final int columns;
    private final double[][] rows;

    private FeatureMatrix(int firstIndex, int columns, double[][] rows) {
        this.firstIndex = firstIndex;
        this.columns = columns;
        this.rows = rows;
    }

    public static FeatureMatrix of(EntityTimeSeries series) {
        double[] values = series.values();
        int n = values.length;

        List<Integer> lags = new ArrayList<>();
        for (int lag : LAGS) {
            if (n > lag) {
                lags.add(lag);
            }
        }
        boolean rolling = n > ROLLING_WINDOW;
        double[] rollingMean = rolling ? RollingStatistics.inclusiveMean(values, ROLLING_WINDOW) : null;
        double[] rollingStd = rolling ? RollingStatistics.inclusiveSampleStd(values, ROLLING_WINDOW) : null;

        int first = lags.isEmpty() ? 0 : lags.get(lags.size() - 1);
        if (rolling) {
            first = Math.max(first, 1);
        }
        int columns = 1 + lags.size() + (rolling ? 2 : 0) + 1;

        double[][] rows = new double[Math.max(0, n - first)][];
        for (int i = first; i < n; i++) {
            double[] row = new double[columns];
            int c = 0;
            row[c++] = values[i];
            for (int lag : lags) {
                row[c++] = values[i - lag];
            }
            if (rolling) {
                row[c++] = rollingMean[i];
                row[c++] = rollingStd[i];
            }
            // Monday = 0 .. Sunday = 6
            row[c] = series.dateAt(i).getDayOfWeek().getValue() - 1;
            rows[i - first] = row;
        }
        return new FeatureMatrix(first, columns, rows);
    }

    public double[][] rows() {
        return rows;
    }

    /**
     * @return width of every row; depends on the series length
     */
    public int columnCount() {
        return columns;
    }

    public int rowCount() {
        return rows.length;
    }

    public boolean isEmpty() {
        return rows.length == 0;
    }

    /**
     * @return index in the source series of feature row {@code row}
     */
    public int seriesIndex(int row) {
        return firstIndex + row;
    }
}
