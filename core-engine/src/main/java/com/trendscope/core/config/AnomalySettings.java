package com.trendscope.core.config;

import com.trendscope.core.model.DetectionMethod;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Settings of the anomaly, change-point and seasonal detectors.
 *
 * @since 1.0.0
 */
public class AnomalySettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Anomaly strategy tag, e.g. {@code isolation_forest} or {@code z_score}. */
    private String strategy = "isolation_forest";

    /** Expected share of outliers; drives the model-based decision threshold. */
    private double contamination = 0.05;

    /** Score above which the formula strategies flag a day. */
    private double threshold = 3.0;

    private int changePointWindow = 7;
    private double changePointThreshold = 2.0;
    private int seasonalPeriod = 7;

    /**
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (strategy == null || strategy.isBlank()) {
            errors.add("'strategy' is required");
        } else {
            try {
                if (!DetectionMethod.fromTag(strategy).isAnomalyStrategy()) {
                    errors.add("'" + strategy + "' is not an anomaly strategy");
                }
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        if (!(contamination > 0 && contamination <= 0.5)) {
            errors.add("'contamination' must be in (0, 0.5], got: " + contamination);
        }
        if (!(threshold > 0)) {
            errors.add("'threshold' must be > 0, got: " + threshold);
        }
        if (changePointWindow < 2) {
            errors.add("'changePointWindow' must be >= 2, got: " + changePointWindow);
        }
        if (!(changePointThreshold > 0)) {
            errors.add("'changePointThreshold' must be > 0, got: " + changePointThreshold);
        }
        if (seasonalPeriod < 2) {
            errors.add("'seasonalPeriod' must be >= 2, got: " + seasonalPeriod);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid anomaly settings: " + String.join("; ", errors));
        }
    }

    public DetectionMethod strategyMethod() {
        return DetectionMethod.fromTag(strategy);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getStrategy() {
        return strategy;
    }

    public void setStrategy(String strategy) {
        this.strategy = strategy != null ? strategy.toLowerCase(Locale.ROOT) : null;
    }

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getChangePointWindow() {
        return changePointWindow;
    }

    public void setChangePointWindow(int changePointWindow) {
        this.changePointWindow = changePointWindow;
    }

    public double getChangePointThreshold() {
        return changePointThreshold;
    }

    public void setChangePointThreshold(double changePointThreshold) {
        this.changePointThreshold = changePointThreshold;
    }

    public int getSeasonalPeriod() {
        return seasonalPeriod;
    }

    public void setSeasonalPeriod(int seasonalPeriod) {
        this.seasonalPeriod = seasonalPeriod;
    }

    @Override
    public String toString() {
        return "AnomalySettings{" +
                "strategy='" + strategy + '\'' +
                ", contamination=" + contamination +
                ", threshold=" + threshold +
                ", changePointWindow=" + changePointWindow +
                ", changePointThreshold=" + changePointThreshold +
                ", seasonalPeriod=" + seasonalPeriod +
                '}';
    }
}
