package com.trendscope.core.event;

import com.trendscope.core.model.CombinedEvent;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Everything the entity event detector found for one entity.
 *
 * <p>
 * Detection lists are empty when the corresponding detector was not
 * requested. Use the {@link Builder} to create instances.
 * </p>
 *
 * @since 1.0.0
 */
public final class EntityEventReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entity;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final long totalMentions;
    private final double averageDailyMentions;
    private final long maxDailyMentions;
    private final List<RawDetection> anomalyEvents;
    private final List<RawDetection> burstEvents;
    private final List<RawDetection> changePointEvents;
    private final List<CombinedEvent> events;

    private EntityEventReport(Builder b) {
        this.entity = Objects.requireNonNull(b.entity, "entity must not be null");
        this.startDate = Objects.requireNonNull(b.startDate, "startDate must not be null");
        this.endDate = Objects.requireNonNull(b.endDate, "endDate must not be null");
        this.totalMentions = b.totalMentions;
        this.averageDailyMentions = b.averageDailyMentions;
        this.maxDailyMentions = b.maxDailyMentions;
        this.anomalyEvents = List.copyOf(b.anomalyEvents);
        this.burstEvents = List.copyOf(b.burstEvents);
        this.changePointEvents = List.copyOf(b.changePointEvents);
        this.events = List.copyOf(b.events);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String entity;
        private LocalDate startDate;
        private LocalDate endDate;
        private long totalMentions;
        private double averageDailyMentions;
        private long maxDailyMentions;
        private List<RawDetection> anomalyEvents = List.of();
        private List<RawDetection> burstEvents = List.of();
        private List<RawDetection> changePointEvents = List.of();
        private List<CombinedEvent> events = List.of();

        public Builder entity(String entity) {
            this.entity = entity;
            return this;
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(LocalDate endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder totalMentions(long totalMentions) {
            this.totalMentions = totalMentions;
            return this;
        }

        public Builder averageDailyMentions(double averageDailyMentions) {
            this.averageDailyMentions = averageDailyMentions;
            return this;
        }

        public Builder maxDailyMentions(long maxDailyMentions) {
            this.maxDailyMentions = maxDailyMentions;
            return this;
        }

        public Builder anomalyEvents(List<RawDetection> anomalyEvents) {
            this.anomalyEvents = anomalyEvents;
            return this;
        }

        public Builder burstEvents(List<RawDetection> burstEvents) {
            this.burstEvents = burstEvents;
            return this;
        }

        public Builder changePointEvents(List<RawDetection> changePointEvents) {
            this.changePointEvents = changePointEvents;
            return this;
        }

        public Builder events(List<CombinedEvent> events) {
            this.events = events;
            return this;
        }

        public EntityEventReport build() {
            return new EntityEventReport(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getEntity() {
        return entity;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public long getTotalMentions() {
        return totalMentions;
    }

    public double getAverageDailyMentions() {
        return averageDailyMentions;
    }

    public long getMaxDailyMentions() {
        return maxDailyMentions;
    }

    public List<RawDetection> getAnomalyEvents() {
        return anomalyEvents;
    }

    public List<RawDetection> getBurstEvents() {
        return burstEvents;
    }

    public List<RawDetection> getChangePointEvents() {
        return changePointEvents;
    }

    public List<CombinedEvent> getEvents() {
        return events;
    }

    @Override
    public String toString() {
        return "EntityEventReport{" +
                "entity='" + entity + '\'' +
                ", span=" + startDate + ".." + endDate +
                ", totalMentions=" + totalMentions +
                ", events=" + events.size() +
                '}';
    }
}
