package com.trendscope.core.detection.model;

/**
 * Unsupervised outlier model trained on feature rows.
 *
 * <p>
 * The decision value is positive for inliers and negative for outliers. Its
 * zero point is calibrated during {@link #fit(double[][])} so that roughly the
 * configured contamination share of the training rows falls below it.
 * </p>
 *
 * @since 1.0.0
 */
public interface OutlierModel {

    /**
     * Train the model.
     *
     * @param rows feature rows; all of equal length, at least two rows
     * @throws IllegalArgumentException if there are fewer than two rows
     */
    void fit(double[][] rows);

    /**
     * @param rows feature rows of the same width as the training rows
     * @return decision value per row; negative means outlier
     * @throws IllegalStateException    if the model has not been fitted
     * @throws IllegalArgumentException if a row's width differs from the
     *                                  training width
     */
    double[] decisionFunction(double[][] rows);

    /**
     * @return {@code true} once {@link #fit(double[][])} has completed
     */
    boolean isFitted();

    /**
     * @return number of columns of the training rows, {@code 0} before fitting
     */
    int featureCount();

    static void checkTrainingRows(String model, double[][] rows) {
        if (rows.length < 2) {
            throw new IllegalArgumentException(model + " needs at least 2 rows, got: " + rows.length);
        }
    }

    static void checkWidth(String model, int expected, double[][] rows) {
        for (double[] row : rows) {
            if (row.length != expected) {
                throw new IllegalArgumentException(
                        model + " was trained on " + expected + " features, got a row of " + row.length);
            }
        }
    }
}
