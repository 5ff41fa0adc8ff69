package com.trendscope.core.forecast;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.concurrent.Cancellation;
import com.trendscope.core.forecast.model.GradientBoostingRegressor;
import com.trendscope.core.forecast.model.PenalizedRegressor;
import com.trendscope.core.forecast.model.RandomForestRegressor;
import com.trendscope.core.forecast.model.Regressor;
import com.trendscope.core.forecast.model.SupportVectorRegressor;
import com.trendscope.core.model.EntityTimeSeries;
import com.trendscope.core.model.ForecastResult;
import com.trendscope.core.model.ModelEvaluation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * Searches regressor parameters by time-series cross validation.
 *
 * <p>
 * Every candidate is scored by {@link ModelEvaluator}'s expanding-window
 * folds on the {@link LagFeatures} of the series, and the candidate with the
 * lowest mean squared error wins. The penalized linear models are searched
 * over their full grids. The tree ensemble and support vector grids are
 * large, so a seeded random sample of their parameter combinations is tried
 * instead, without repeats.
 * </p>
 *
 * <p>
 * Series shorter than {@value ModelEvaluator#MIN_HISTORY_DAYS} days are not
 * tuned. A candidate whose fit fails is skipped; a family with no surviving
 * candidate is left out of the result.
 * </p>
 *
 * <pre>{@code
 * HyperparameterTuner tuner = new HyperparameterTuner();
 * TuningResult result = tuner.tuneAllModels(series);
 * result.getBest().ifPresent(best -> tuner.predictWithTunedModel(best, series, 7));
 * }</pre>
 *
 * @since 1.0.0
 */
public class HyperparameterTuner {

    private static final Logger LOG = LoggerFactory.getLogger(HyperparameterTuner.class);

    public static final int DEFAULT_ITERATIONS = 20;
    public static final long DEFAULT_SEED = 42L;

    static final double[] ALPHAS = {0.01, 0.1, 1.0, 10.0, 100.0};
    static final double[] L1_RATIOS = {0.1, 0.3, 0.5, 0.7, 0.9};
    static final int[] FOREST_TREES = {50, 100, 200};
    static final int[] FOREST_DEPTHS = {5, 10, 15, 20};
    static final int[] NODE_SIZES = {2, 5, 10};
    static final double[] BOOSTING_RATES = {0.01, 0.05, 0.1, 0.2};
    static final int[] BOOSTING_DEPTHS = {3, 5, 7};
    static final double[] BOOSTING_SUBSAMPLES = {0.8, 0.9, 1.0};
    static final double[] SVR_C = {0.1, 1.0, 10.0, 100.0};
    static final double[] SVR_GAMMAS = {Double.NaN, 0.01, 0.1, 1.0};
    static final double[] SVR_EPSILONS = {0.01, 0.1, 0.2, 0.5};

    private final ModelEvaluator evaluator;
    private final int iterations;
    private final long seed;

    public HyperparameterTuner() {
        this(ModelEvaluator.DEFAULT_FOLDS, DEFAULT_ITERATIONS, DEFAULT_SEED);
    }

    /**
     * @param folds      cross-validation folds per candidate
     * @param iterations candidates sampled from each random-search grid
     * @param seed       seed of the grid sampling and of the forests
     */
    public HyperparameterTuner(int folds, int iterations, long seed) {
        this.evaluator = new ModelEvaluator(folds);
        this.iterations = InvalidParameterException.requireAtLeast("iterations", iterations, 1);
        this.seed = seed;
    }

    /** Ridge and lasso over every alpha, elastic net over every alpha and L1 ratio. */
    public Map<String, TunedModel> tuneLinearModels(EntityTimeSeries series) {
        List<Candidate> ridge = new ArrayList<>();
        List<Candidate> lasso = new ArrayList<>();
        List<Candidate> elasticNet = new ArrayList<>();
        for (double alpha : ALPHAS) {
            ridge.add(new Candidate(params("alpha", alpha), () -> PenalizedRegressor.ridge(alpha)));
            lasso.add(new Candidate(params("alpha", alpha), () -> PenalizedRegressor.lasso(alpha)));
            for (double ratio : L1_RATIOS) {
                Map<String, Object> params = params("alpha", alpha);
                params.put("l1_ratio", ratio);
                elasticNet.add(new Candidate(params, () -> PenalizedRegressor.elasticNet(alpha, ratio)));
            }
        }
        Map<String, TunedModel> tuned = new LinkedHashMap<>();
        tuned.putAll(tune(series, "ridge", ForecastModel.LINEAR_REGRESSION, ridge));
        tuned.putAll(tune(series, "lasso", ForecastModel.LINEAR_REGRESSION, lasso));
        tuned.putAll(tune(series, "elastic_net", ForecastModel.LINEAR_REGRESSION, elasticNet));
        return tuned;
    }

    /** Random forest and gradient boosting, each over a random sample of its grid. */
    public Map<String, TunedModel> tuneTreeModels(EntityTimeSeries series) {
        List<Candidate> forest = new ArrayList<>();
        List<Candidate> boosting = new ArrayList<>();
        for (int trees : FOREST_TREES) {
            for (int nodeSize : NODE_SIZES) {
                for (int depth : FOREST_DEPTHS) {
                    Map<String, Object> params = params("trees", trees);
                    params.put("max_depth", depth);
                    params.put("node_size", nodeSize);
                    forest.add(new Candidate(params,
                            () -> new RandomForestRegressor(trees, depth, nodeSize, seed)));
                }
                for (int depth : BOOSTING_DEPTHS) {
                    for (double rate : BOOSTING_RATES) {
                        for (double subsample : BOOSTING_SUBSAMPLES) {
                            Map<String, Object> params = params("trees", trees);
                            params.put("learning_rate", rate);
                            params.put("max_depth", depth);
                            params.put("node_size", nodeSize);
                            params.put("subsample", subsample);
                            boosting.add(new Candidate(params, () -> new GradientBoostingRegressor(trees, rate,
                                    depth, nodeSize, subsample, seed)));
                        }
                    }
                }
            }
        }
        Map<String, TunedModel> tuned = new LinkedHashMap<>();
        tuned.putAll(tune(series, ForecastModel.RANDOM_FOREST.getTag(), ForecastModel.RANDOM_FOREST, sample(forest)));
        tuned.putAll(tune(series, "gradient_boosting", ForecastModel.RANDOM_FOREST, sample(boosting)));
        return tuned;
    }

    /** Support vector regression over a random sample of kernel, C, gamma and epsilon. */
    public Map<String, TunedModel> tuneSvrModel(EntityTimeSeries series) {
        List<Candidate> grid = new ArrayList<>();
        for (SupportVectorRegressor.Kernel kernel : SupportVectorRegressor.Kernel.values()) {
            for (double c : SVR_C) {
                // gamma only shapes the RBF kernel
                double[] gammas = kernel == SupportVectorRegressor.Kernel.RBF
                        ? SVR_GAMMAS
                        : new double[] {Double.NaN};
                for (double gamma : gammas) {
                    for (double epsilon : SVR_EPSILONS) {
                        Map<String, Object> params = params("kernel", kernel.name().toLowerCase(Locale.ROOT));
                        params.put("C", c);
                        if (kernel == SupportVectorRegressor.Kernel.RBF) {
                            params.put("gamma", Double.isNaN(gamma) ? "scale" : gamma);
                        }
                        params.put("epsilon", epsilon);
                        grid.add(new Candidate(params,
                                () -> new SupportVectorRegressor(kernel, c, epsilon, gamma)));
                    }
                }
            }
        }
        return tune(series, ForecastModel.SVR.getTag(), ForecastModel.SVR, sample(grid));
    }

    /**
     * Tune every family.
     *
     * @return tuned models by name, empty when the series is too short
     */
    public TuningResult tuneAllModels(EntityTimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        Map<String, TunedModel> models = new LinkedHashMap<>();
        if (tooShort(series)) {
            return new TuningResult(models);
        }
        models.putAll(tuneLinearModels(series));
        models.putAll(tuneTreeModels(series));
        models.putAll(tuneSvrModel(series));
        TuningResult result = new TuningResult(models);
        result.getBest().ifPresent(best -> LOG.info("Best tuned model for '{}': [{}] {} with MSE {}",
                series.getEntity(), best.getName(), best.getParams(), best.getMse()));
        return result;
    }

    /**
     * Forecast recursively with a tuned regressor trained on the whole
     * history. Predictions are clamped at zero and the result is tagged with
     * the tuned model's name.
     *
     * @throws ForecastException if the history is too short to train on
     */
    public ForecastResult predictWithTunedModel(TunedModel model, EntityTimeSeries history, int horizon) {
        Objects.requireNonNull(model, "model must not be null");
        ForecastResult result = new TunedForecaster(model).forecast(history, horizon);
        return new ForecastResult(result.getEntity(), model.getName(), result.getValues());
    }

    // ---------------------------------------------------------------
    // Search
    // ---------------------------------------------------------------

    private Map<String, TunedModel> tune(EntityTimeSeries series, String name, ForecastModel family,
            List<Candidate> candidates) {
        Objects.requireNonNull(series, "series must not be null");
        Map<String, TunedModel> result = new LinkedHashMap<>();
        if (tooShort(series)) {
            return result;
        }

        LagFeatures features = LagFeatures.of(series.values());
        Candidate best = null;
        double bestMse = Double.POSITIVE_INFINITY;
        for (Candidate candidate : candidates) {
            Cancellation.checkpoint();
            try {
                ModelEvaluation evaluation = evaluator.crossValidate(name, candidate.factory, features);
                if (evaluation.getMse() < bestMse) {
                    best = candidate;
                    bestMse = evaluation.getMse();
                }
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                LOG.debug("Candidate [{}] {} failed for '{}': {}", name, candidate.params, series.getEntity(),
                        e.getMessage());
            }
        }

        if (best == null) {
            LOG.warn("No [{}] candidate could be fitted for '{}'", name, series.getEntity());
            return result;
        }
        LOG.info("Tuned [{}] for '{}' over {} candidate(s): {} with MSE {}", name, series.getEntity(),
                candidates.size(), best.params, bestMse);
        result.put(name, new TunedModel(name, family, best.params, bestMse, best.factory));
        return result;
    }

    private List<Candidate> sample(List<Candidate> grid) {
        if (grid.size() <= iterations) {
            return grid;
        }
        List<Candidate> shuffled = new ArrayList<>(grid);
        Collections.shuffle(shuffled, new Random(seed));
        return shuffled.subList(0, iterations);
    }

    private static boolean tooShort(EntityTimeSeries series) {
        if (series.size() < ModelEvaluator.MIN_HISTORY_DAYS) {
            LOG.warn("Not enough data to tune models for '{}': {} day(s), need {}", series.getEntity(),
                    series.size(), ModelEvaluator.MIN_HISTORY_DAYS);
            return true;
        }
        return false;
    }

    private static Map<String, Object> params(String key, Object value) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(key, value);
        return params;
    }

    public int getIterations() {
        return iterations;
    }

    private static final class Candidate {
        private final Map<String, Object> params;
        private final Supplier<Regressor> factory;

        Candidate(Map<String, Object> params, Supplier<Regressor> factory) {
            this.params = params;
            this.factory = factory;
        }
    }
}
