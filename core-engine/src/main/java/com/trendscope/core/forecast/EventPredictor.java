package com.trendscope.core.forecast;

import com.trendscope.core.EntityNotFoundException;
import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.concurrent.AnalysisExecutor;
import com.trendscope.core.config.ForecastSettings;
import com.trendscope.core.model.EntityTimeSeries;
import com.trendscope.core.model.ForecastResult;
import com.trendscope.core.model.ModelEvaluation;
import com.trendscope.core.model.PredictedEvent;
import com.trendscope.core.series.TimeSeriesProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Forecasts an entity's mentions and derives the days on which a spike of
 * coverage is expected.
 *
 * <h3>Predicted events</h3>
 * <p>
 * A forecast day is an event when its ensemble value reaches the event
 * threshold and no forecast day within {@code neighborWindow} days on
 * either side has a value at least as high. A window of one compares only
 * with the immediate neighbours. Confidence is
 * {@link PredictedEvent#confidence(double, double)}.
 * </p>
 *
 * @since 1.0.0
 */
public class EventPredictor {

    private static final Logger LOG = LoggerFactory.getLogger(EventPredictor.class);

    private final TimeSeriesProvider provider;
    private final EnsembleForecaster ensemble;
    private final ModelEvaluator evaluator;
    private final int neighborWindow;

    /**
     * @param evaluator cross-validates the regressors alongside each forecast,
     *                  or {@code null} to skip evaluation
     */
    public EventPredictor(TimeSeriesProvider provider, EnsembleForecaster ensemble, ModelEvaluator evaluator,
            int neighborWindow) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.ensemble = Objects.requireNonNull(ensemble, "ensemble must not be null");
        this.evaluator = evaluator;
        this.neighborWindow = InvalidParameterException.requireAtLeast("neighborWindow", neighborWindow, 1);
    }

    public static EventPredictor fromSettings(TimeSeriesProvider provider, ForecastSettings settings,
            AnalysisExecutor executor) {
        Objects.requireNonNull(settings, "ForecastSettings must not be null");
        return new EventPredictor(provider, EnsembleForecaster.fromSettings(settings, executor),
                settings.isEvaluateModels() ? new ModelEvaluator() : null, settings.getPeakNeighborWindow());
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Forecast the daily mentions of one entity.
     *
     * @param horizonDays days to forecast past the last history day
     * @return the forecast, or empty when the entity has no mentions in range
     * @throws EntityNotFoundException if the entity is unknown
     */
    public Optional<EntityForecast> predictEntityMentions(String entity, int horizonDays, LocalDate start,
            LocalDate end) {
        InvalidParameterException.requireAtLeast("horizonDays", horizonDays, 1);
        LOG.info("Predicting future mentions for entity '{}'", entity);
        EntityTimeSeries history = provider.getEntityTimeSeries(entity, start, end);
        if (history.isEmpty()) {
            LOG.warn("No data available for entity '{}'", entity);
            return Optional.empty();
        }

        Map<ForecastModel, ForecastOutcome> outcomes = ensemble.forecastEach(history, horizonDays);
        ForecastResult combined = EnsembleForecaster.combine(entity, EnsembleForecaster.successful(outcomes));
        Map<String, ForecastOutcome> byTag = new LinkedHashMap<>();
        outcomes.forEach((model, outcome) -> byTag.put(model.getTag(), outcome));
        if (combined.isEmpty()) {
            LOG.warn("Every forecasting model failed for '{}'; prediction unavailable", entity);
        }

        Map<String, ModelEvaluation> evaluation = evaluator != null
                ? evaluator.evaluate(history) : Collections.emptyMap();

        return Optional.of(EntityForecast.builder()
                .entity(entity)
                .historyStart(history.getStartDate())
                .historyEnd(history.getEndDate())
                .historyDays(history.size())
                .horizonDays(horizonDays)
                .outcomes(byTag)
                .ensemble(combined)
                .evaluation(evaluation)
                .build());
    }

    /**
     * Forecast one entity and pick out the predicted events.
     *
     * @return the events, or empty when the entity has no mentions in range
     * @throws EntityNotFoundException if the entity is unknown
     */
    public Optional<EventPredictionReport> predictEntityEvents(String entity, int horizonDays, double eventThreshold,
            LocalDate start, LocalDate end) {
        InvalidParameterException.requirePositive("eventThreshold", eventThreshold);
        return predictEntityMentions(entity, horizonDays, start, end)
                .map(forecast -> eventsOf(forecast, eventThreshold));
    }

    /**
     * Predicted events of an already computed forecast.
     */
    public EventPredictionReport eventsOf(EntityForecast forecast, double eventThreshold) {
        ForecastResult combined = forecast.getEnsemble();
        List<PredictedEvent> events = findPredictedEvents(combined, eventThreshold, neighborWindow);
        LOG.info("Predicted {} event(s) for '{}'", events.size(), forecast.getEntity());
        SortedMap<LocalDate, Double> values = combined.getValues();
        return new EventPredictionReport(forecast.getEntity(),
                values.isEmpty() ? null : values.firstKey(),
                values.isEmpty() ? null : values.lastKey(),
                eventThreshold, events);
    }

    /**
     * Local peaks of a forecast at or above the threshold.
     *
     * @return events in date order
     */
    public static List<PredictedEvent> findPredictedEvents(ForecastResult forecast, double threshold,
            int neighborWindow) {
        Objects.requireNonNull(forecast, "forecast must not be null");
        InvalidParameterException.requirePositive("threshold", threshold);
        InvalidParameterException.requireAtLeast("neighborWindow", neighborWindow, 1);

        SortedMap<LocalDate, Double> values = forecast.getValues();
        List<PredictedEvent> events = new ArrayList<>();
        for (Map.Entry<LocalDate, Double> entry : values.entrySet()) {
            LocalDate date = entry.getKey();
            double value = entry.getValue();
            if (value < threshold) {
                continue;
            }
            boolean peak = true;
            for (int offset = 1; offset <= neighborWindow && peak; offset++) {
                Double before = values.get(date.minusDays(offset));
                Double after = values.get(date.plusDays(offset));
                peak = (before == null || before < value) && (after == null || after < value);
            }
            if (peak) {
                events.add(new PredictedEvent(forecast.getEntity(), date, value,
                        PredictedEvent.confidence(value, threshold)));
            }
        }
        return events;
    }

    public int getNeighborWindow() {
        return neighborWindow;
    }
}
