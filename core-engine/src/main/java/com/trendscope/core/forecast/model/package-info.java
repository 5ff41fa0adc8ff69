/**
 * Regression models behind the lag-feature forecasters and the tuner.
 * Ordinary least squares runs on Commons Math; the forest, boosting, support
 * vector and penalized linear regressors wrap Smile.
 */
package com.trendscope.core.forecast.model;
