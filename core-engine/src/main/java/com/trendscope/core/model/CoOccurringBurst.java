package com.trendscope.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Dates on which at least two entities were bursting at the same time,
 * merged into one cross-entity record.
 *
 * @since 1.0.0
 */
public final class CoOccurringBurst implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int id;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final SortedSet<String> entities;
    private final List<LocalDate> dates;

    public CoOccurringBurst(int id, SortedSet<String> entities, List<LocalDate> dates) {
        Objects.requireNonNull(dates, "dates must not be null");
        if (dates.isEmpty()) {
            throw new IllegalArgumentException("A co-occurring burst needs at least one date");
        }
        this.id = id;
        this.entities = Collections.unmodifiableSortedSet(new TreeSet<>(entities));
        this.dates = List.copyOf(dates);
        this.startDate = this.dates.get(0);
        this.endDate = this.dates.get(this.dates.size() - 1);
    }

    public int getId() {
        return id;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public SortedSet<String> getEntities() {
        return entities;
    }

    public List<LocalDate> getDates() {
        return dates;
    }

    /**
     * @return number of co-occurrence dates merged into this record
     */
    public int getDuration() {
        return dates.size();
    }

    public String getDescription() {
        return "Co-occurring burst involving " + entities.size() + " entities";
    }

    @Override
    public String toString() {
        return "CoOccurringBurst{id=" + id + ", start=" + startDate + ", end=" + endDate
                + ", entities=" + entities + '}';
    }
}
