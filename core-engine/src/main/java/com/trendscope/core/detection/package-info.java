/**
 * Per-entity detection engine.
 *
 * <p>
 * All detectors implement the
 * {@link com.trendscope.core.detection.Detector} interface and are
 * instantiated via {@link com.trendscope.core.detection.DetectorFactory}.
 * Built-in detectors:
 * </p>
 * <ul>
 * <li>{@link com.trendscope.core.detection.AnomalyDetector}: model-based and
 * statistical anomaly strategies, plus contextual and combined views</li>
 * <li>{@link com.trendscope.core.detection.BurstDetector}: sudden rises over
 * a trailing baseline, burst events, peaks and multi-scale scores</li>
 * <li>{@link com.trendscope.core.detection.ChangePointDetector}: shifts in
 * the mean level</li>
 * <li>{@link com.trendscope.core.detection.SeasonalDetector}: deviations from
 * the usual level of a weekday</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a detector family, implement {@code Detector}, add a
 * {@code DetectorKind} constant and register it in
 * {@code DetectorFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendscope.core.detection;
