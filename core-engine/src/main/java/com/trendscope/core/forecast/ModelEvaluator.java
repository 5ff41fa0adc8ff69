package com.trendscope.core.forecast;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.concurrent.Cancellation;
import com.trendscope.core.forecast.model.LinearRegressor;
import com.trendscope.core.forecast.model.RandomForestRegressor;
import com.trendscope.core.forecast.model.Regressor;
import com.trendscope.core.forecast.model.SupportVectorRegressor;
import com.trendscope.core.model.EntityTimeSeries;
import com.trendscope.core.model.ModelEvaluation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * Time-series cross validation of the lag-feature regressors.
 *
 * <h3>Folds</h3>
 * <p>
 * The lag rows are cut into {@code folds + 1} equal blocks (the remainder
 * goes to the first training block). Fold {@code k} trains on everything
 * before block {@code k} and tests on block {@code k}, so the training
 * window only ever grows and never sees the future.
 * </p>
 *
 * <p>
 * Each model reports MSE, MAE and R² averaged over the folds. A model whose
 * fit fails on any fold is left out of the result.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ModelEvaluator.class);

    public static final int DEFAULT_FOLDS = 5;
    public static final int MIN_HISTORY_DAYS = 30;

    private final int folds;
    private final Map<String, Supplier<Regressor>> models = new LinkedHashMap<>();

    public ModelEvaluator() {
        this(DEFAULT_FOLDS);
    }

    public ModelEvaluator(int folds) {
        this.folds = InvalidParameterException.requireAtLeast("folds", folds, 2);
        models.put(ForecastModel.LINEAR_REGRESSION.getTag(), LinearRegressor::new);
        models.put(ForecastModel.RANDOM_FOREST.getTag(),
                () -> new RandomForestRegressor(TreeEnsembleForecaster.RANDOM_SEED));
        models.put(ForecastModel.SVR.getTag(), SupportVectorRegressor::new);
    }

    /**
     * @return evaluation per model name, or an empty map when the series is
     *         shorter than {@value #MIN_HISTORY_DAYS} days
     */
    public Map<String, ModelEvaluation> evaluate(EntityTimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        Map<String, ModelEvaluation> results = new LinkedHashMap<>();
        if (series.size() < MIN_HISTORY_DAYS) {
            LOG.warn("Not enough data to evaluate models for '{}': {} day(s), need {}", series.getEntity(),
                    series.size(), MIN_HISTORY_DAYS);
            return results;
        }

        LagFeatures features = LagFeatures.of(series.values());
        for (Map.Entry<String, Supplier<Regressor>> model : models.entrySet()) {
            try {
                results.put(model.getKey(), crossValidate(model.getKey(), model.getValue(), features));
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                LOG.warn("Evaluation of [{}] failed for '{}': {}", model.getKey(), series.getEntity(),
                        e.getMessage());
            }
        }
        LOG.info("Evaluated {} model(s) for '{}' over {} fold(s)", results.size(), series.getEntity(), folds);
        return results;
    }

    /**
     * Average fold metrics of one regressor family.
     *
     * @throws CancellationException if the calling thread is interrupted
     *                               between folds
     */
    ModelEvaluation crossValidate(String name, Supplier<Regressor> factory, LagFeatures features) {
        int testSize = features.size() / (folds + 1);
        double mse = 0;
        double mae = 0;
        double r2 = 0;
        for (int fold = 0; fold < folds; fold++) {
            Cancellation.checkpoint();
            int testStart = features.size() - (folds - fold) * testSize;
            int testEnd = testStart + testSize;
            Regressor regressor = factory.get();
            regressor.fit(features.rows(0, testStart), features.targets(0, testStart));
            double[] actual = features.targets(testStart, testEnd);
            double[] predicted = regressor.predict(features.rows(testStart, testEnd));
            mse += meanSquaredError(actual, predicted);
            mae += meanAbsoluteError(actual, predicted);
            r2 += rSquared(actual, predicted);
        }
        return new ModelEvaluation(name, mse / folds, mae / folds, r2 / folds, folds);
    }

    // ---------------------------------------------------------------
    // Metrics
    // ---------------------------------------------------------------

    static double meanSquaredError(double[] actual, double[] predicted) {
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            double d = actual[i] - predicted[i];
            sum += d * d;
        }
        return sum / actual.length;
    }

    static double meanAbsoluteError(double[] actual, double[] predicted) {
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            sum += Math.abs(actual[i] - predicted[i]);
        }
        return sum / actual.length;
    }

    /**
     * Coefficient of determination. A constant target scores 1 when predicted
     * exactly and 0 otherwise.
     */
    static double rSquared(double[] actual, double[] predicted) {
        double mean = 0;
        for (double v : actual) {
            mean += v;
        }
        mean /= actual.length;
        double residual = 0;
        double total = 0;
        for (int i = 0; i < actual.length; i++) {
            residual += (actual[i] - predicted[i]) * (actual[i] - predicted[i]);
            total += (actual[i] - mean) * (actual[i] - mean);
        }
        if (total == 0) {
            return residual == 0 ? 1.0 : 0.0;
        }
        return 1.0 - residual / total;
    }

    public int getFolds() {
        return folds;
    }
}
