package com.trendscope.core.detection.model;

/**
 * Training rows shared by the outlier model tests: a tight cluster around
 * the origin followed by one far-away row.
 */
final class OutlierModelFixtures {

    static final int OUTLIER = 24;

    private OutlierModelFixtures() {
    }

    static double[][] clusterWithOutlier() {
        double[][] rows = new double[OUTLIER + 1][];
        for (int i = 0; i < OUTLIER; i++) {
            double angle = i * Math.PI / 12;
            double radius = 0.5 + (i % 3) * 0.25;
            rows[i] = new double[] { radius * Math.cos(angle), radius * Math.sin(angle) };
        }
        rows[OUTLIER] = new double[] { 12.0, 12.0 };
        return rows;
    }

    static int argMin(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] < values[best]) {
                best = i;
            }
        }
        return best;
    }
}
