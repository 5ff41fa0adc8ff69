package com.trendscope.core.detection;

/**
 * The family a {@link Detector} belongs to.
 *
 * @since 1.0.0
 */
public enum DetectorKind {
    ANOMALY,
    BURST,
    CHANGE_POINT,
    SEASONAL
}
