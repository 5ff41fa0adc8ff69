package com.trendscope.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One entity event unifying overlapping raw detections.
 *
 * <p>
 * Date, value and description come from the highest-scoring detection of the
 * group; {@code methods} lists every detector that contributed, and
 * {@code score} is the mean of the contributing detectors' scores.
 * </p>
 *
 * @since 1.0.0
 */
public final class CombinedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entity;
    private final LocalDate date;
    private final double value;
    private final Set<DetectionMethod> methods;
    private final double score;
    private final String description;

    public CombinedEvent(String entity, LocalDate date, double value, Set<DetectionMethod> methods, double score,
            String description) {
        this.entity = Objects.requireNonNull(entity, "entity must not be null");
        this.date = Objects.requireNonNull(date, "date must not be null");
        Objects.requireNonNull(methods, "methods must not be null");
        if (methods.isEmpty()) {
            throw new IllegalArgumentException("A combined event needs at least one contributing method");
        }
        this.value = value;
        this.methods = Collections.unmodifiableSet(EnumSet.copyOf(methods));
        this.score = score;
        this.description = description;
    }

    public String getEntity() {
        return entity;
    }

    public LocalDate getDate() {
        return date;
    }

    public double getValue() {
        return value;
    }

    public Set<DetectionMethod> getMethods() {
        return methods;
    }

    public double getScore() {
        return score;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "CombinedEvent{" +
                "entity='" + entity + '\'' +
                ", date=" + date +
                ", methods=" + methods +
                ", score=" + score +
                '}';
    }
}
