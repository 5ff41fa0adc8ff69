package com.trendscope.core.forecast;

import com.trendscope.core.model.EntityTimeSeries;
import com.trendscope.core.model.ForecastResult;

/**
 * One forecasting strategy.
 *
 * <p>
 * A forecaster extrapolates a daily series for {@code horizon} days past its
 * last date. Implementations are stateless between calls and safe to share
 * across threads.
 * </p>
 *
 * @since 1.0.0
 */
public interface Forecaster {

    /**
     * @param history daily series, oldest first
     * @param horizon number of days to forecast
     * @return one value per day after the last history date, clamped at zero
     * @throws ForecastException if this strategy cannot forecast the series
     */
    ForecastResult forecast(EntityTimeSeries history, int horizon);

    ForecastModel model();
}
