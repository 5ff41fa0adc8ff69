package com.trendscope.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Cross-validated error of one regression model, averaged over folds.
 *
 * @since 1.0.0
 */
public final class ModelEvaluation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String model;
    private final double mse;
    private final double mae;
    private final double r2;
    private final int folds;

    public ModelEvaluation(String model, double mse, double mae, double r2, int folds) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.mse = mse;
        this.mae = mae;
        this.r2 = r2;
        this.folds = folds;
    }

    public String getModel() {
        return model;
    }

    public double getMse() {
        return mse;
    }

    public double getMae() {
        return mae;
    }

    public double getR2() {
        return r2;
    }

    public int getFolds() {
        return folds;
    }

    @Override
    public String toString() {
        return "ModelEvaluation{model='" + model + "', mse=" + mse + ", mae=" + mae + ", r2=" + r2
                + ", folds=" + folds + '}';
    }
}
