package com.trendscope.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Score and verdict of one detector for one day of a series.
 *
 * <p>
 * Scores are oriented so that a higher value always means "more unusual",
 * whichever {@link DetectionMethod} produced them.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDate date;
    private final double value;
    private final double score;
    private final boolean anomaly;
    private final DetectionMethod method;

    public AnomalyRecord(LocalDate date, double value, double score, boolean anomaly, DetectionMethod method) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.value = value;
        this.score = score;
        this.anomaly = anomaly;
        this.method = Objects.requireNonNull(method, "method must not be null");
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

    public boolean isAnomaly() {
        return anomaly;
    }

    public DetectionMethod getMethod() {
        return method;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyRecord that))
            return false;
        return Double.compare(value, that.value) == 0
                && Double.compare(score, that.score) == 0
                && anomaly == that.anomaly
                && date.equals(that.date)
                && method == that.method;
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, value, score, anomaly, method);
    }

    @Override
    public String toString() {
        return "AnomalyRecord{" +
                "date=" + date +
                ", value=" + value +
                ", score=" + score +
                ", anomaly=" + anomaly +
                ", method=" + method +
                '}';
    }
}
