package com.trendscope.core.detection;

import com.trendscope.core.model.AnomalyRecord;
import com.trendscope.core.model.DetectionMethod;
import com.trendscope.core.model.EntityTimeSeries;

import java.util.List;

/**
 * Contract for all per-series detectors.
 *
 * <p>
 * A detector scores each day of a series and flags the unusual ones.
 * {@link #detect(EntityTimeSeries)} must not modify shared state, so one
 * instance can serve many entities from several worker threads at once.
 * </p>
 *
 * <p>
 * An empty or too-short series yields an empty or all-zero result, never an
 * exception.
 * </p>
 *
 * @since 1.0.0
 */
public interface Detector {

    /**
     * Score a series.
     *
     * @param series the series to analyse
     * @return one record per scored day, in date order
     */
    List<AnomalyRecord> detect(EntityTimeSeries series);

    /**
     * @return family of this detector
     */
    DetectorKind kind();

    /**
     * @return method tag stamped on every record this detector emits
     */
    DetectionMethod method();
}
