package com.trendscope.core.detection.model;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.concurrent.Cancellation;
import smile.anomaly.SVM;
import smile.math.kernel.GaussianKernel;

/**
 * One-class support vector machine with an RBF kernel, trained by Smile's
 * {@link SVM}.
 *
 * <p>
 * The kernel width defaults to {@code gamma = 1 / (features * variance)}, the
 * variance taken over every entry of the training matrix, and is handed to
 * Smile as {@code sigma = sqrt(1 / (2 * gamma))}. The decision value is
 * Smile's {@code sum_i a_i K(x_i, x) - rho}, positive inside the learned
 * support.
 * </p>
 *
 * @since 1.0.0
 */
public final class OneClassSvm implements OutlierModel {

    private static final double TOLERANCE = 1e-3;

    private final double nu;

    private SVM<double[]> svm;
    private double gamma;
    private int width;

    /**
     * @param nu upper bound on the share of training rows treated as outliers
     */
    public OneClassSvm(double nu) {
        this.nu = InvalidParameterException.requireInRange("nu", nu, 0.0, 1.0);
    }

    @Override
    public void fit(double[][] rows) {
        OutlierModel.checkTrainingRows("One-class SVM", rows);
        Cancellation.checkpoint();
        gamma = scaleGamma(rows);
        svm = SVM.fit(rows, new GaussianKernel(Math.sqrt(1.0 / (2.0 * gamma))), nu, TOLERANCE);
        width = rows[0].length;
    }

    @Override
    public double[] decisionFunction(double[][] rows) {
        if (!isFitted()) {
            throw new IllegalStateException("One-class SVM has not been fitted");
        }
        OutlierModel.checkWidth("One-class SVM", width, rows);
        double[] decisions = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            decisions[i] = svm.score(rows[i]);
        }
        return decisions;
    }

    @Override
    public boolean isFitted() {
        return svm != null;
    }

    @Override
    public int featureCount() {
        return width;
    }

    double getGamma() {
        return gamma;
    }

    /**
     * {@code 1 / (features * variance)} over every entry of {@code rows}, or
     * {@code 1} when all entries are equal.
     */
    public static double scaleGamma(double[][] rows) {
        int features = rows[0].length;
        double sum = 0;
        double sumSquares = 0;
        int count = 0;
        for (double[] row : rows) {
            for (double v : row) {
                sum += v;
                sumSquares += v * v;
                count++;
            }
        }
        double mean = sum / count;
        double variance = sumSquares / count - mean * mean;
        return variance > 0 ? 1.0 / (features * variance) : 1.0;
    }
}
