package com.trendscope.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Tag naming the detector that produced a score.
 *
 * <p>
 * The first six values are the interchangeable anomaly strategies; the rest
 * identify the seasonal, change-point and burst detectors.
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectionMethod {

    ISOLATION_FOREST("isolation_forest", true),
    LOCAL_OUTLIER_FACTOR("local_outlier_factor", true),
    ONE_CLASS_SVM("one_class_svm", true),
    Z_SCORE("z_score", false),
    IQR("iqr", false),
    MOVING_AVERAGE("moving_average", false),
    SEASONAL("seasonal", false),
    CHANGE_POINT("change_point", false),
    BURST("burst", false);

    private final String tag;
    private final boolean modelBased;

    DetectionMethod(String tag, boolean modelBased) {
        this.tag = tag;
        this.modelBased = modelBased;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /**
     * @return {@code true} when the method trains a model on the feature matrix
     */
    public boolean isModelBased() {
        return modelBased;
    }

    /**
     * @return {@code true} for the six interchangeable anomaly strategies
     */
    public boolean isAnomalyStrategy() {
        return ordinal() <= MOVING_AVERAGE.ordinal();
    }

    /**
     * Resolve a method from its tag, case-insensitively.
     *
     * @param tag method tag such as {@code z_score}
     * @return matching method
     * @throws IllegalArgumentException if the tag is unknown
     */
    public static DetectionMethod fromTag(String tag) {
        Objects.requireNonNull(tag, "Detection method tag must not be null");
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (DetectionMethod method : values()) {
            if (method.tag.equals(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown detection method: '" + tag + "'");
    }

    @Override
    public String toString() {
        return tag;
    }
}
