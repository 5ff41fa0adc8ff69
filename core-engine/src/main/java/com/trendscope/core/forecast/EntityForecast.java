package com.trendscope.core.forecast;

import com.trendscope.core.model.ForecastResult;
import com.trendscope.core.model.ModelEvaluation;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Mention forecast of one entity: the history it was fitted on, what each
 * strategy produced, and their ensemble.
 *
 * @since 1.0.0
 */
public final class EntityForecast implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entity;
    private final LocalDate historyStart;
    private final LocalDate historyEnd;
    private final int historyDays;
    private final int horizonDays;
    private final Map<String, ForecastOutcome> outcomes;
    private final ForecastResult ensemble;
    private final Map<String, ModelEvaluation> evaluation;

    private EntityForecast(Builder builder) {
        this.entity = Objects.requireNonNull(builder.entity, "entity must not be null");
        this.historyStart = Objects.requireNonNull(builder.historyStart, "historyStart must not be null");
        this.historyEnd = Objects.requireNonNull(builder.historyEnd, "historyEnd must not be null");
        this.historyDays = builder.historyDays;
        this.horizonDays = builder.horizonDays;
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.outcomes));
        this.ensemble = Objects.requireNonNull(builder.ensemble, "ensemble must not be null");
        this.evaluation = Collections.unmodifiableMap(new LinkedHashMap<>(builder.evaluation));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getEntity() {
        return entity;
    }

    public LocalDate getHistoryStart() {
        return historyStart;
    }

    public LocalDate getHistoryEnd() {
        return historyEnd;
    }

    public int getHistoryDays() {
        return historyDays;
    }

    public int getHorizonDays() {
        return horizonDays;
    }

    /** Outcome per strategy tag, in configuration order. */
    public Map<String, ForecastOutcome> getOutcomes() {
        return outcomes;
    }

    public ForecastResult getEnsemble() {
        return ensemble;
    }

    /** Cross-validation results; empty when evaluation was off or the history too short. */
    public Map<String, ModelEvaluation> getEvaluation() {
        return evaluation;
    }

    /** {@code false} when every strategy failed. */
    public boolean isAvailable() {
        return !ensemble.isEmpty();
    }

    @Override
    public String toString() {
        return "EntityForecast{entity='" + entity + "', history=" + historyStart + ".." + historyEnd
                + ", horizonDays=" + horizonDays + ", models=" + outcomes.keySet() + '}';
    }

    public static final class Builder {
        private String entity;
        private LocalDate historyStart;
        private LocalDate historyEnd;
        private int historyDays;
        private int horizonDays;
        private Map<String, ForecastOutcome> outcomes = Collections.emptyMap();
        private ForecastResult ensemble;
        private Map<String, ModelEvaluation> evaluation = Collections.emptyMap();

        private Builder() {
        }

        public Builder entity(String entity) {
            this.entity = entity;
            return this;
        }

        public Builder historyStart(LocalDate historyStart) {
            this.historyStart = historyStart;
            return this;
        }

        public Builder historyEnd(LocalDate historyEnd) {
            this.historyEnd = historyEnd;
            return this;
        }

        public Builder historyDays(int historyDays) {
            this.historyDays = historyDays;
            return this;
        }

        public Builder horizonDays(int horizonDays) {
            this.horizonDays = horizonDays;
            return this;
        }

        public Builder outcomes(Map<String, ForecastOutcome> outcomes) {
            this.outcomes = outcomes;
            return this;
        }

        public Builder ensemble(ForecastResult ensemble) {
            this.ensemble = ensemble;
            return this;
        }

        public Builder evaluation(Map<String, ModelEvaluation> evaluation) {
            this.evaluation = evaluation;
            return this;
        }

        public EntityForecast build() {
            return new EntityForecast(this);
        }
    }
}
