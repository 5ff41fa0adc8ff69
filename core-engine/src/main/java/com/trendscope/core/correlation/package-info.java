/**
 * Correlation between entity mention series and the graphs built from it.
 *
 * <p>
 * {@link com.trendscope.core.correlation.CorrelationAnalyzer} computes
 * static and lagged coefficients.
 * {@link com.trendscope.core.correlation.EntityGraph} holds the resulting
 * networks as plain node and edge lists, and
 * {@link com.trendscope.core.correlation.CommunityDetection} partitions them.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendscope.core.correlation;
