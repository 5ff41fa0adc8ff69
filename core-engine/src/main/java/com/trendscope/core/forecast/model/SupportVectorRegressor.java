package com.trendscope.core.forecast.model;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.concurrent.Cancellation;
import com.trendscope.core.detection.model.OneClassSvm;
import smile.math.kernel.GaussianKernel;
import smile.math.kernel.LinearKernel;
import smile.math.kernel.MercerKernel;
import smile.regression.Regression;
import smile.regression.SVM;

/**
 * Epsilon-insensitive support vector regression, trained by Smile's
 * {@link SVM}.
 *
 * <p>
 * With the {@link Kernel#RBF} kernel and no explicit {@code gamma}, the kernel
 * width is scaled to the training rows as {@link OneClassSvm#scaleGamma}
 * does.
 * </p>
 *
 * @since 1.0.0
 */
public final class SupportVectorRegressor implements Regressor {

    public static final double DEFAULT_C = 1.0;
    public static final double DEFAULT_EPSILON = 0.1;

    private static final double TOLERANCE = 1e-3;

    public enum Kernel {
        RBF,
        LINEAR
    }

    private final Kernel kernel;
    private final double c;
    private final double epsilon;
    private final double gamma;
    private Regression<double[]> model;
    private int width;

    public SupportVectorRegressor() {
        this(Kernel.RBF, DEFAULT_C, DEFAULT_EPSILON, Double.NaN);
    }

    /**
     * @param gamma RBF kernel coefficient, or {@code NaN} to scale it to the
     *              training rows; ignored by the linear kernel
     */
    public SupportVectorRegressor(Kernel kernel, double c, double epsilon, double gamma) {
        this.kernel = kernel;
        this.c = InvalidParameterException.requirePositive("C", c);
        this.epsilon = InvalidParameterException.requirePositive("epsilon", epsilon);
        this.gamma = Double.isNaN(gamma) ? gamma : InvalidParameterException.requirePositive("gamma", gamma);
    }

    @Override
    public void fit(double[][] rows, double[] targets) {
        Regressor.checkShape(rows, targets);
        Cancellation.checkpoint();
        MercerKernel<double[]> mercer;
        if (kernel == Kernel.LINEAR) {
            mercer = new LinearKernel();
        } else {
            double g = Double.isNaN(gamma) ? OneClassSvm.scaleGamma(rows) : gamma;
            mercer = new GaussianKernel(Math.sqrt(1.0 / (2.0 * g)));
        }
        model = SVM.fit(rows, targets, mercer, epsilon, c, TOLERANCE);
        width = rows[0].length;
    }

    @Override
    public double predict(double[] row) {
        if (model == null) {
            throw new IllegalStateException("Support vector regressor has not been fitted");
        }
        Regressor.checkWidth(width, row);
        return model.predict(row);
    }

    public Kernel getKernel() {
        return kernel;
    }

    public double getC() {
        return c;
    }

    public double getEpsilon() {
        return epsilon;
    }
}
