package com.trendscope.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Contiguous daily mention counts of one entity.
 *
 * <p>
 * Every calendar day between the first and the last point carries an explicit
 * count; days without mentions hold {@code 0}. Instances are read-only
 * snapshots built per request, so they can be shared freely between worker
 * threads.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * The constructor verifies that points are ordered, gap-free and
 * non-negative. Use {@link #ofCounts(String, LocalDate, long...)} to build a
 * series from a start date and a run of counts.
 * </p>
 *
 * @since 1.0.0
 */
public final class EntityTimeSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entity;
    private final List<DailyCount> points;

    /**
     * @param entity entity identifier; must not be {@code null}
     * @param points daily counts in ascending, contiguous date order
     * @throws IllegalArgumentException if the points are not one day apart
     */
    public EntityTimeSeries(String entity, List<DailyCount> points) {
        this.entity = Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(points, "points must not be null");
        for (int i = 1; i < points.size(); i++) {
            LocalDate expected = points.get(i - 1).getDate().plusDays(1);
            if (!points.get(i).getDate().equals(expected)) {
                throw new IllegalArgumentException("Series for '" + entity + "' is not contiguous: expected "
                        + expected + " but found " + points.get(i).getDate());
            }
        }
        this.points = List.copyOf(points);
    }

    public static EntityTimeSeries empty(String entity) {
        return new EntityTimeSeries(entity, Collections.emptyList());
    }

    /**
     * Build a series whose first count falls on {@code start}.
     *
     * @param entity entity identifier
     * @param start  date of the first count
     * @param counts consecutive daily counts
     * @return new series
     */
    public static EntityTimeSeries ofCounts(String entity, LocalDate start, long... counts) {
        Objects.requireNonNull(start, "start must not be null");
        List<DailyCount> points = new ArrayList<>(counts.length);
        for (int i = 0; i < counts.length; i++) {
            points.add(new DailyCount(start.plusDays(i), counts[i]));
        }
        return new EntityTimeSeries(entity, points);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getEntity() {
        return entity;
    }

    public List<DailyCount> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public LocalDate getStartDate() {
        return points.isEmpty() ? null : points.get(0).getDate();
    }

    public LocalDate getEndDate() {
        return points.isEmpty() ? null : points.get(points.size() - 1).getDate();
    }

    public LocalDate dateAt(int index) {
        return points.get(index).getDate();
    }

    public double valueAt(int index) {
        return points.get(index).getCount();
    }

    /**
     * @return a fresh array with the counts as doubles
     */
    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getCount();
        }
        return values;
    }

    public List<LocalDate> dates() {
        return points.stream().map(DailyCount::getDate).toList();
    }

    /**
     * Index of {@code date} in this series, or {@code -1} when outside it.
     */
    public int indexOf(LocalDate date) {
        if (points.isEmpty() || date.isBefore(getStartDate()) || date.isAfter(getEndDate())) {
            return -1;
        }
        return (int) (date.toEpochDay() - getStartDate().toEpochDay());
    }

    public long total() {
        long total = 0;
        for (DailyCount point : points) {
            total += point.getCount();
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EntityTimeSeries that))
            return false;
        return entity.equals(that.entity) && points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity, points);
    }

    @Override
    public String toString() {
        return "EntityTimeSeries{entity='" + entity + "', start=" + getStartDate()
                + ", end=" + getEndDate() + ", days=" + points.size() + '}';
    }
}
