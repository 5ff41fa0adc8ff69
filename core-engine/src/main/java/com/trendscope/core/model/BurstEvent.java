package com.trendscope.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A run of burst days merged into one event.
 *
 * <p>
 * {@code values} holds the counts of the contributing (flagged) days in date
 * order; the duration is the calendar span from start to end, inclusive.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. Start, end and peak dates are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class BurstEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDate startDate;
    private final LocalDate endDate;
    private final LocalDate peakDate;
    private final double peakValue;
    private final double peakScore;
    private final List<LocalDate> dates;
    private final List<Double> values;

    private BurstEvent(Builder builder) {
        this.startDate = Objects.requireNonNull(builder.startDate, "startDate must not be null");
        this.endDate = Objects.requireNonNull(builder.endDate, "endDate must not be null");
        this.peakDate = Objects.requireNonNull(builder.peakDate, "peakDate must not be null");
        this.peakValue = builder.peakValue;
        this.peakScore = builder.peakScore;
        this.dates = List.copyOf(builder.dates);
        this.values = List.copyOf(builder.values);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates flagged days while an event is open, tracking the running
     * peak.
     */
    public static class Builder {
        private LocalDate startDate;
        private LocalDate endDate;
        private LocalDate peakDate;
        private double peakValue = Double.NEGATIVE_INFINITY;
        private double peakScore;
        private final List<LocalDate> dates = new ArrayList<>();
        private final List<Double> values = new ArrayList<>();

        /**
         * Append a flagged day. The first day opens the event; a strictly
         * larger value moves the peak.
         */
        public Builder addDay(LocalDate date, double value, double score) {
            if (startDate == null) {
                startDate = date;
            }
            endDate = date;
            dates.add(date);
            values.add(value);
            if (value > peakValue) {
                peakDate = date;
                peakValue = value;
                peakScore = score;
            }
            return this;
        }

        public LocalDate getEndDate() {
            return endDate;
        }

        public long durationDays() {
            return startDate == null ? 0 : ChronoUnit.DAYS.between(startDate, endDate) + 1;
        }

        public BurstEvent build() {
            return new BurstEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public LocalDate getPeakDate() {
        return peakDate;
    }

    public double getPeakValue() {
        return peakValue;
    }

    public double getPeakScore() {
        return peakScore;
    }

    public long getDurationDays() {
        return ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    public List<LocalDate> getDates() {
        return dates;
    }

    public List<Double> getValues() {
        return values;
    }

    /**
     * @return {@code true} when {@code date} is one of the flagged days
     */
    public boolean covers(LocalDate date) {
        return dates.contains(date);
    }

    @Override
    public String toString() {
        return "BurstEvent{" +
                "start=" + startDate +
                ", end=" + endDate +
                ", peak=" + peakDate +
                ", peakValue=" + peakValue +
                ", peakScore=" + peakScore +
                ", days=" + dates.size() +
                '}';
    }
}
