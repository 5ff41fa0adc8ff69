package com.trendscope.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the burst detector.
 *
 * @since 1.0.0
 */
public class BurstSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Burst score a day must exceed to be flagged. */
    private double sensitivity = 2.0;

    /** Number of preceding days forming the rolling baseline. */
    private int windowSize = 3;

    private int minBurstDuration = 1;

    /** Largest day gap between flagged days still merged into one event. */
    private int maxBurstGap = 1;

    private List<Integer> scales = new ArrayList<>(List.of(3, 7, 14, 30));

    private double peakProminence = 1.0;
    private double peakWidth = 1.0;

    /**
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!(sensitivity > 0)) {
            errors.add("'sensitivity' must be > 0, got: " + sensitivity);
        }
        if (windowSize < 1) {
            errors.add("'windowSize' must be >= 1, got: " + windowSize);
        }
        if (minBurstDuration < 1) {
            errors.add("'minBurstDuration' must be >= 1, got: " + minBurstDuration);
        }
        if (maxBurstGap < 1) {
            errors.add("'maxBurstGap' must be >= 1, got: " + maxBurstGap);
        }
        if (scales == null || scales.isEmpty()) {
            errors.add("'scales' must list at least one window size");
        } else if (scales.stream().anyMatch(scale -> scale == null || scale < 1)) {
            errors.add("'scales' must only contain window sizes >= 1, got: " + scales);
        }
        if (peakProminence < 0) {
            errors.add("'peakProminence' must be >= 0, got: " + peakProminence);
        }
        if (peakWidth < 0) {
            errors.add("'peakWidth' must be >= 0, got: " + peakWidth);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid burst settings: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getSensitivity() {
        return sensitivity;
    }

    public void setSensitivity(double sensitivity) {
        this.sensitivity = sensitivity;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public int getMinBurstDuration() {
        return minBurstDuration;
    }

    public void setMinBurstDuration(int minBurstDuration) {
        this.minBurstDuration = minBurstDuration;
    }

    public int getMaxBurstGap() {
        return maxBurstGap;
    }

    public void setMaxBurstGap(int maxBurstGap) {
        this.maxBurstGap = maxBurstGap;
    }

    public List<Integer> getScales() {
        return scales;
    }

    public void setScales(List<Integer> scales) {
        this.scales = scales != null ? new ArrayList<>(scales) : null;
    }

    public double getPeakProminence() {
        return peakProminence;
    }

    public void setPeakProminence(double peakProminence) {
        this.peakProminence = peakProminence;
    }

    public double getPeakWidth() {
        return peakWidth;
    }

    public void setPeakWidth(double peakWidth) {
        this.peakWidth = peakWidth;
    }

    @Override
    public String toString() {
        return "BurstSettings{" +
                "sensitivity=" + sensitivity +
                ", windowSize=" + windowSize +
                ", minBurstDuration=" + minBurstDuration +
                ", maxBurstGap=" + maxBurstGap +
                ", scales=" + scales +
                '}';
    }
}
