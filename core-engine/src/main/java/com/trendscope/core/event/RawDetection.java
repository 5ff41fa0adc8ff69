package com.trendscope.core.event;

import com.trendscope.core.model.DetectionMethod;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One flagged day reported by a single detector, before overlapping
 * detections are merged into a {@link com.trendscope.core.model.CombinedEvent}.
 *
 * @since 1.0.0
 */
public final class RawDetection implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDate date;
    private final double value;
    private final double score;
    private final DetectionMethod method;
    private final String description;

    public RawDetection(LocalDate date, double value, double score, DetectionMethod method, String description) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.value = value;
        this.score = score;
        this.description = description;
    }

    public LocalDate getDate() {
        return date;
    }

    public double getValue() {
        return value;
    }

    public double getScore() {
        return score;
    }

    public DetectionMethod getMethod() {
        return method;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "RawDetection{" + method + " @ " + date + ", value=" + value + ", score=" + score + '}';
    }
}
