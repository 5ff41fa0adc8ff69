package com.trendscope.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Number of mentions an entity received on one calendar day.
 *
 * @since 1.0.0
 */
public final class DailyCount implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDate date;
    private final long count;

    public DailyCount(LocalDate date, long count) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got: " + count + " on " + date);
        }
        this.count = count;
    }

    public LocalDate getDate() {
        return date;
    }

    public long getCount() {
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DailyCount that))
            return false;
        return count == that.count && date.equals(that.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, count);
    }

    @Override
    public String toString() {
        return date + "=" + count;
    }
}
