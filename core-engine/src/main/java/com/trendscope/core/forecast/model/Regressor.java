package com.trendscope.core.forecast.model;

/**
 * Supervised regression model over numeric feature rows.
 *
 * @since 1.0.0
 */
public interface Regressor {

    /**
     * Train the model.
     *
     * @param rows    feature rows, all of equal width
     * @param targets one target per row
     * @throws IllegalArgumentException if rows and targets disagree in length
     *                                  or there are too few rows to fit
     */
    void fit(double[][] rows, double[] targets);

    /**
     * @param row feature row of the training width
     * @return predicted target
     * @throws IllegalStateException if the model has not been fitted
     */
    double predict(double[] row);

    default double[] predict(double[][] rows) {
        double[] predictions = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            predictions[i] = predict(rows[i]);
        }
        return predictions;
    }

    static void checkShape(double[][] rows, double[] targets) {
        if (rows.length != targets.length) {
            throw new IllegalArgumentException(
                    "Got " + rows.length + " rows but " + targets.length + " targets");
        }
        if (rows.length == 0) {
            throw new IllegalArgumentException("Cannot fit a regressor on no rows");
        }
    }

    static void checkWidth(int expected, double[] row) {
        if (row.length != expected) {
            throw new IllegalArgumentException(
                    "Regressor was trained on " + expected + " features, got a row of " + row.length);
        }
    }
}
