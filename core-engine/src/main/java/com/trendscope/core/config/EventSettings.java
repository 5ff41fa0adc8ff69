package com.trendscope.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the single-entity, multi-entity and cross-entity event
 * detectors.
 *
 * @since 1.0.0
 */
public class EventSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Largest day gap between raw detections folded into one event. */
    private int maxDaysGap = 3;

    private double correlatedMinCorrelation = 0.7;
    private double causalMinCorrelation = 0.5;

    /** Days either side of a cross-entity peak covered by the event. */
    private int clusterThreshold = 3;

    /** Multi-entity articles a day needs to count as a cross-entity peak. */
    private int minArticles = 2;

    private double minTrustScore = 0.5;

    /**
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (maxDaysGap < 0) {
            errors.add("'maxDaysGap' must be >= 0, got: " + maxDaysGap);
        }
        if (!(correlatedMinCorrelation >= 0 && correlatedMinCorrelation <= 1)) {
            errors.add("'correlatedMinCorrelation' must be in [0, 1], got: " + correlatedMinCorrelation);
        }
        if (!(causalMinCorrelation >= 0 && causalMinCorrelation <= 1)) {
            errors.add("'causalMinCorrelation' must be in [0, 1], got: " + causalMinCorrelation);
        }
        if (clusterThreshold < 0) {
            errors.add("'clusterThreshold' must be >= 0, got: " + clusterThreshold);
        }
        if (minArticles < 1) {
            errors.add("'minArticles' must be >= 1, got: " + minArticles);
        }
        if (!(minTrustScore >= 0 && minTrustScore <= 1)) {
            errors.add("'minTrustScore' must be in [0, 1], got: " + minTrustScore);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid event settings: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getMaxDaysGap() {
        return maxDaysGap;
    }

    public void setMaxDaysGap(int maxDaysGap) {
        this.maxDaysGap = maxDaysGap;
    }

    public double getCorrelatedMinCorrelation() {
        return correlatedMinCorrelation;
    }

    public void setCorrelatedMinCorrelation(double correlatedMinCorrelation) {
        this.correlatedMinCorrelation = correlatedMinCorrelation;
    }

    public double getCausalMinCorrelation() {
        return causalMinCorrelation;
    }

    public void setCausalMinCorrelation(double causalMinCorrelation) {
        this.causalMinCorrelation = causalMinCorrelation;
    }

    public int getClusterThreshold() {
        return clusterThreshold;
    }

    public void setClusterThreshold(int clusterThreshold) {
        this.clusterThreshold = clusterThreshold;
    }

    public int getMinArticles() {
        return minArticles;
    }

    public void setMinArticles(int minArticles) {
        this.minArticles = minArticles;
    }

    public double getMinTrustScore() {
        return minTrustScore;
    }

    public void setMinTrustScore(double minTrustScore) {
        this.minTrustScore = minTrustScore;
    }

    @Override
    public String toString() {
        return "EventSettings{" +
                "maxDaysGap=" + maxDaysGap +
                ", correlatedMinCorrelation=" + correlatedMinCorrelation +
                ", causalMinCorrelation=" + causalMinCorrelation +
                ", clusterThreshold=" + clusterThreshold +
                ", minArticles=" + minArticles +
                ", minTrustScore=" + minTrustScore +
                '}';
    }
}
