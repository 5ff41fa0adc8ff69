/**
 * Higher-level events built from the detectors and the correlation analyzer.
 *
 * <ul>
 * <li>{@link com.trendscope.core.event.EntityEventDetector}: merged events of
 * a single entity</li>
 * <li>{@link com.trendscope.core.event.MultiEntityEventDetector}: correlated,
 * co-occurring and lead/lag structure across entities</li>
 * <li>{@link com.trendscope.core.event.CrossEntityEventDetector}: spikes of
 * articles that mention several entities together</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.trendscope.core.event;
