package com.trendscope.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-day verdict of the anomaly, change-point, seasonal and burst detectors
 * run side by side.
 *
 * <p>
 * The combined score is the mean of the four individual scores; the day is
 * an event when <em>any</em> individual detector flagged it.
 * </p>
 *
 * @since 1.0.0
 */
public final class CombinedDetection implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Kinds of evidence that feed a combined detection. */
    public enum Signal {
        ANOMALY, CHANGE_POINT, SEASONAL, BURST
    }

    private final LocalDate date;
    private final double value;
    private final EnumMap<Signal, Double> scores;
    private final EnumMap<Signal, Boolean> flags;

    public CombinedDetection(LocalDate date, double value, Map<Signal, Double> scores, Map<Signal, Boolean> flags) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.value = value;
        this.scores = new EnumMap<>(Signal.class);
        this.flags = new EnumMap<>(Signal.class);
        for (Signal signal : Signal.values()) {
            this.scores.put(signal, scores.getOrDefault(signal, 0.0));
            this.flags.put(signal, flags.getOrDefault(signal, Boolean.FALSE));
        }
    }

    public LocalDate getDate() {
        return date;
    }

    public double getValue() {
        return value;
    }

    public Map<Signal, Double> getScores() {
        return Collections.unmodifiableMap(scores);
    }

    public Map<Signal, Boolean> getFlags() {
        return Collections.unmodifiableMap(flags);
    }

    public double getCombinedScore() {
        double sum = 0;
        for (double score : scores.values()) {
            sum += score;
        }
        return sum / scores.size();
    }

    public boolean isEvent() {
        return flags.containsValue(Boolean.TRUE);
    }

    @Override
    public String toString() {
        return "CombinedDetection{date=" + date + ", value=" + value + ", scores=" + scores
                + ", flags=" + flags + '}';
    }
}
