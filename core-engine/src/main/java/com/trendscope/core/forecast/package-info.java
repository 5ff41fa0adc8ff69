/**
 * Mention forecasting: five independent strategies, their averaging
 * ensemble, predicted events at forecast peaks, and cross validation of the
 * lag-feature regressors.
 *
 * <p>
 * Strategies fail one at a time. A {@link com.trendscope.core.forecast.ForecastException}
 * removes only the strategy that threw it from the ensemble.
 * </p>
 */
package com.trendscope.core.forecast;
