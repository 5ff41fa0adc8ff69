package com.trendscope.core.forecast;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.concurrent.AnalysisExecutor;
import com.trendscope.core.concurrent.TaskOutcome;
import com.trendscope.core.config.ForecastSettings;
import com.trendscope.core.model.EntityTimeSeries;
import com.trendscope.core.model.ForecastResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

/**
 * Runs several {@link Forecaster}s over the same history and averages what
 * they predict.
 *
 * <h3>Partial failure</h3>
 * <p>
 * Each strategy runs in isolation. One that throws, or overruns its task
 * budget, is recorded as a failed {@link ForecastOutcome} and left out of the
 * average; the remaining strategies are unaffected. For every date the
 * ensemble value is the mean of exactly the strategies that predicted that
 * date. When no strategy succeeds the ensemble is empty.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleForecaster {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleForecaster.class);

    /** Model name of the averaged forecast. */
    public static final String ENSEMBLE_MODEL = "ensemble";

    private final List<Forecaster> forecasters;
    private final AnalysisExecutor executor;

    /**
     * @param executor worker pool for the strategies, or {@code null} to run
     *                 them one after another on the calling thread
     */
    public EnsembleForecaster(List<? extends Forecaster> forecasters, AnalysisExecutor executor) {
        Objects.requireNonNull(forecasters, "forecasters must not be null");
        if (forecasters.isEmpty()) {
            throw new InvalidParameterException("forecasters", "must name at least one forecasting model");
        }
        this.forecasters = List.copyOf(forecasters);
        this.executor = executor;
    }

    public static EnsembleForecaster fromSettings(ForecastSettings settings, AnalysisExecutor executor) {
        Objects.requireNonNull(settings, "ForecastSettings must not be null");
        List<Forecaster> forecasters = settings.forecastModels().stream()
                .map(ForecastModel::newForecaster)
                .toList();
        return new EnsembleForecaster(forecasters, executor);
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Run every strategy.
     *
     * @return one outcome per strategy, in configuration order
     */
    public Map<ForecastModel, ForecastOutcome> forecastEach(EntityTimeSeries history, int horizon) {
        Objects.requireNonNull(history, "history must not be null");
        InvalidParameterException.requireAtLeast("horizon", horizon, 1);

        Map<ForecastModel, ForecastOutcome> outcomes = new EnumMap<>(ForecastModel.class);
        if (executor == null) {
            for (Forecaster forecaster : forecasters) {
                outcomes.put(forecaster.model(), attempt(forecaster, history, horizon));
            }
            return ordered(outcomes);
        }

        Map<ForecastModel, Callable<ForecastOutcome>> tasks = new LinkedHashMap<>();
        for (Forecaster forecaster : forecasters) {
            tasks.put(forecaster.model(), () -> attempt(forecaster, history, horizon));
        }
        executor.invokeAll(tasks).forEach((model, outcome) -> outcomes.put(model, unwrap(model, outcome)));
        return ordered(outcomes);
    }

    /**
     * Run every strategy and average the successful ones.
     *
     * @return the ensemble forecast, empty when every strategy failed
     */
    public ForecastResult forecast(EntityTimeSeries history, int horizon) {
        return combine(history.getEntity(), successful(forecastEach(history, horizon)));
    }

    /**
     * Average forecasts date by date. A date predicted by only some of the
     * forecasts is averaged over those.
     */
    public static ForecastResult combine(String entity, Collection<ForecastResult> results) {
        Objects.requireNonNull(results, "results must not be null");
        Map<LocalDate, double[]> sums = new TreeMap<>();
        for (ForecastResult result : results) {
            result.getValues().forEach((date, value) -> {
                double[] sum = sums.computeIfAbsent(date, d -> new double[2]);
                sum[0] += value;
                sum[1]++;
            });
        }
        Map<LocalDate, Double> means = new TreeMap<>();
        sums.forEach((date, sum) -> means.put(date, sum[0] / sum[1]));
        return new ForecastResult(entity, ENSEMBLE_MODEL, means);
    }

    public static List<ForecastResult> successful(Map<ForecastModel, ForecastOutcome> outcomes) {
        List<ForecastResult> results = new ArrayList<>();
        for (ForecastOutcome outcome : outcomes.values()) {
            if (outcome.isSuccess()) {
                results.add(outcome.getResult());
            }
        }
        return results;
    }

    public List<ForecastModel> getModels() {
        return forecasters.stream().map(Forecaster::model).toList();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static ForecastOutcome attempt(Forecaster forecaster, EntityTimeSeries history, int horizon) {
        ForecastModel model = forecaster.model();
        try {
            ForecastResult result = forecaster.forecast(history, horizon);
            LOG.debug("Forecaster [{}] produced {} day(s) for '{}'", model, result.getValues().size(),
                    history.getEntity());
            return ForecastOutcome.succeeded(result);
        } catch (ForecastException e) {
            LOG.warn("Forecaster [{}] skipped for '{}': {}", model, history.getEntity(), e.getMessage());
            return ForecastOutcome.failed(model, e.getMessage());
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.error("Forecaster [{}] failed for '{}': {}", model, history.getEntity(), e.getMessage(), e);
            return ForecastOutcome.failed(model, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static ForecastOutcome unwrap(ForecastModel model, TaskOutcome<ForecastOutcome> outcome) {
        if (outcome.isSuccess()) {
            return outcome.getValue().orElseGet(() -> ForecastOutcome.failed(model, "no result"));
        }
        LOG.warn("Forecaster [{}] did not finish: {}", model, outcome.describeFailure());
        return ForecastOutcome.failed(model, outcome.describeFailure());
    }

    private Map<ForecastModel, ForecastOutcome> ordered(Map<ForecastModel, ForecastOutcome> outcomes) {
        Map<ForecastModel, ForecastOutcome> ordered = new LinkedHashMap<>();
        for (Forecaster forecaster : forecasters) {
            ordered.put(forecaster.model(), outcomes.get(forecaster.model()));
        }
        return ordered;
    }
}
