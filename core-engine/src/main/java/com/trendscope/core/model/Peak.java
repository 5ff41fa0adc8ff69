package com.trendscope.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A local maximum of a series with its topographic prominence and its width
 * at half prominence.
 *
 * @since 1.0.0
 */
public final class Peak implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDate date;
    private final double value;
    private final double prominence;
    private final double width;

    public Peak(LocalDate date, double value, double prominence, double width) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.value = value;
        this.prominence = prominence;
        this.width = width;
    }

    public LocalDate getDate() {
        return date;
    }

    public double getValue() {
        return value;
    }

    public double getProminence() {
        return prominence;
    }

    public double getWidth() {
        return width;
    }

    @Override
    public String toString() {
        return "Peak{date=" + date + ", value=" + value + ", prominence=" + prominence + ", width=" + width + '}';
    }
}
