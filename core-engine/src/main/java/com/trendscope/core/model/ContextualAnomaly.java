package com.trendscope.core.model;

import java.io.Serializable;
import java.time.DayOfWeek;
import java.util.Objects;

/**
 * An {@link AnomalyRecord} enriched with a day-of-week baseline.
 *
 * <p>
 * The contextual score measures how far the value lies from the mean of all
 * values falling on the same weekday. The combined score is the mean of the
 * base and contextual scores; the combined flag is raised when either flag
 * is.
 * </p>
 *
 * @since 1.0.0
 */
public final class ContextualAnomaly implements Serializable {

    private static final long serialVersionUID = 1L;

    private final AnomalyRecord base;
    private final DayOfWeek dayOfWeek;
    private final double contextualScore;
    private final boolean contextualAnomaly;

    public ContextualAnomaly(AnomalyRecord base, double contextualScore, boolean contextualAnomaly) {
        this.base = Objects.requireNonNull(base, "base record must not be null");
        this.dayOfWeek = base.getDate().getDayOfWeek();
        this.contextualScore = contextualScore;
        this.contextualAnomaly = contextualAnomaly;
    }

    public AnomalyRecord getBase() {
        return base;
    }

    public DayOfWeek getDayOfWeek() {
        return dayOfWeek;
    }

    public double getContextualScore() {
        return contextualScore;
    }

    public boolean isContextualAnomaly() {
        return contextualAnomaly;
    }

    public double getCombinedScore() {
        return (base.getScore() + contextualScore) / 2.0;
    }

    public boolean isCombinedAnomaly() {
        return base.isAnomaly() || contextualAnomaly;
    }

    @Override
    public String toString() {
        return "ContextualAnomaly{" +
                "date=" + base.getDate() +
                ", dayOfWeek=" + dayOfWeek +
                ", score=" + base.getScore() +
                ", contextualScore=" + contextualScore +
                ", combined=" + isCombinedAnomaly() +
                '}';
    }
}
