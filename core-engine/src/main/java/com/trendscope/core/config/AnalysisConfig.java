package com.trendscope.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the analysis YAML configuration.
 *
 * <p>
 * Expected YAML structure (every section optional; omitted sections and keys
 * keep their defaults):
 * </p>
 *
 * <pre>
 * anomaly:
 *   strategy: isolation_forest
 *   contamination: 0.05
 * burst:
 *   sensitivity: 2.0
 *   windowSize: 3
 * correlation:
 *   method: pearson
 *   minCorrelation: 0.5
 * events:
 *   maxDaysGap: 3
 * forecast:
 *   horizonDays: 14
 * execution:
 *   parallelism: 0
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every section.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private AnomalySettings anomaly = new AnomalySettings();
    private BurstSettings burst = new BurstSettings();
    private CorrelationSettings correlation = new CorrelationSettings();
    private EventSettings events = new EventSettings();
    private ForecastSettings forecast = new ForecastSettings();
    private ExecutionSettings execution = new ExecutionSettings();

    /**
     * @return configuration holding every default
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig();
    }

    /**
     * Validate every section.
     *
     * <p>
     * Collects the errors of all sections and throws a single exception
     * listing them, so a broken file is reported in one go.
     * </p>
     *
     * @throws IllegalStateException if one or more sections are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        collect(errors, anomaly::validate);
        collect(errors, burst::validate);
        collect(errors, correlation::validate);
        collect(errors, events::validate);
        collect(errors, forecast::validate);
        collect(errors, execution::validate);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Analysis configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static void collect(List<String> errors, Runnable validation) {
        try {
            validation.run();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (setters used by SnakeYAML)
    // ---------------------------------------------------------------

    public AnomalySettings getAnomaly() {
        return anomaly;
    }

    public void setAnomaly(AnomalySettings anomaly) {
        this.anomaly = anomaly != null ? anomaly : new AnomalySettings();
    }

    public BurstSettings getBurst() {
        return burst;
    }

    public void setBurst(BurstSettings burst) {
        this.burst = burst != null ? burst : new BurstSettings();
    }

    public CorrelationSettings getCorrelation() {
        return correlation;
    }

    public void setCorrelation(CorrelationSettings correlation) {
        this.correlation = correlation != null ? correlation : new CorrelationSettings();
    }

    public EventSettings getEvents() {
        return events;
    }

    public void setEvents(EventSettings events) {
        this.events = events != null ? events : new EventSettings();
    }

    public ForecastSettings getForecast() {
        return forecast;
    }

    public void setForecast(ForecastSettings forecast) {
        this.forecast = forecast != null ? forecast : new ForecastSettings();
    }

    public ExecutionSettings getExecution() {
        return execution;
    }

    public void setExecution(ExecutionSettings execution) {
        this.execution = execution != null ? execution : new ExecutionSettings();
    }

    @Override
    public String toString() {
        return "AnalysisConfig{" +
                "anomaly=" + anomaly +
                ", burst=" + burst +
                ", correlation=" + correlation +
                ", events=" + events +
                ", forecast=" + forecast +
                ", execution=" + execution +
                '}';
    }
}
