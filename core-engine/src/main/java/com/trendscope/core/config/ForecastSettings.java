package com.trendscope.core.config;

import com.trendscope.core.forecast.ForecastModel;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the forecasting ensemble and the event predictor.
 *
 * @since 1.0.0
 */
public class ForecastSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private int horizonDays = 14;

    /** Forecast value a local peak must reach to become a predicted event. */
    private double eventThreshold = 3.0;

    /** Days on each side a predicted peak must dominate. */
    private int peakNeighborWindow = 1;

    /** Cross-validate the lag regression models alongside each mention forecast. */
    private boolean evaluateModels = true;

    private List<String> models = new ArrayList<>(List.of(
            "arima", "exponential_smoothing", "linear_regression", "random_forest", "svr"));

    /**
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (horizonDays < 1) {
            errors.add("'horizonDays' must be >= 1, got: " + horizonDays);
        }
        if (!(eventThreshold > 0)) {
            errors.add("'eventThreshold' must be > 0, got: " + eventThreshold);
        }
        if (peakNeighborWindow < 1) {
            errors.add("'peakNeighborWindow' must be >= 1, got: " + peakNeighborWindow);
        }
        if (models == null || models.isEmpty()) {
            errors.add("'models' must name at least one forecasting model");
        } else {
            for (String model : models) {
                try {
                    ForecastModel.fromTag(model);
                } catch (IllegalArgumentException | NullPointerException e) {
                    errors.add(e.getMessage());
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid forecast settings: " + String.join("; ", errors));
        }
    }

    public List<ForecastModel> forecastModels() {
        return models.stream().map(ForecastModel::fromTag).distinct().toList();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getHorizonDays() {
        return horizonDays;
    }

    public void setHorizonDays(int horizonDays) {
        this.horizonDays = horizonDays;
    }

    public double getEventThreshold() {
        return eventThreshold;
    }

    public void setEventThreshold(double eventThreshold) {
        this.eventThreshold = eventThreshold;
    }

    public int getPeakNeighborWindow() {
        return peakNeighborWindow;
    }

    public void setPeakNeighborWindow(int peakNeighborWindow) {
        this.peakNeighborWindow = peakNeighborWindow;
    }

    public boolean isEvaluateModels() {
        return evaluateModels;
    }

    public void setEvaluateModels(boolean evaluateModels) {
        this.evaluateModels = evaluateModels;
    }

    public List<String> getModels() {
        return models;
    }

    public void setModels(List<String> models) {
        this.models = models != null ? new ArrayList<>(models) : null;
    }

    @Override
    public String toString() {
        return "ForecastSettings{" +
                "horizonDays=" + horizonDays +
                ", eventThreshold=" + eventThreshold +
                ", peakNeighborWindow=" + peakNeighborWindow +
                ", evaluateModels=" + evaluateModels +
                ", models=" + models +
                '}';
    }
}
