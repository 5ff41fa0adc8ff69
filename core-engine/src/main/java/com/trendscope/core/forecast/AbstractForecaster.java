package com.trendscope.core.forecast;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.model.EntityTimeSeries;
import com.trendscope.core.model.ForecastResult;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base class that turns an array extrapolation into a dated
 * {@link ForecastResult}.
 *
 * <p>
 * Subclasses only see the raw values and return one prediction per horizon
 * day. Non-finite predictions are rejected here; negative ones are clamped
 * by the result.
 * </p>
 *
 * @since 1.0.0
 */
abstract class AbstractForecaster implements Forecaster {

    @Override
    public final ForecastResult forecast(EntityTimeSeries history, int horizon) {
        Objects.requireNonNull(history, "history must not be null");
        InvalidParameterException.requireAtLeast("horizon", horizon, 1);
        if (history.isEmpty()) {
            throw new ForecastException(model(), "history is empty");
        }

        double[] predictions = extrapolate(history.values(), horizon);
        LocalDate last = history.getEndDate();
        Map<LocalDate, Double> values = new LinkedHashMap<>();
        for (int h = 0; h < horizon; h++) {
            if (!Double.isFinite(predictions[h])) {
                throw new ForecastException(model(), "non-finite prediction for day " + (h + 1));
            }
            values.put(last.plusDays(h + 1L), predictions[h]);
        }
        return new ForecastResult(history.getEntity(), model().getTag(), values);
    }

    /**
     * @param values  history, oldest first, never empty
     * @param horizon days to predict, at least one
     * @return exactly {@code horizon} predictions
     * @throws ForecastException if the history does not support this model
     */
    protected abstract double[] extrapolate(double[] values, int horizon);

    protected ForecastException insufficient(int required, int actual) {
        return new ForecastException(model(),
                "needs at least " + required + " days of history, got " + actual);
    }
}
