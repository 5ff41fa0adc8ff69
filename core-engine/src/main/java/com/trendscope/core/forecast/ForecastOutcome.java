package com.trendscope.core.forecast;

import com.trendscope.core.model.ForecastResult;

import java.io.Serializable;
import java.util.Objects;

/**
 * What one strategy produced in an ensemble run: a forecast, or the reason
 * it has none.
 *
 * @since 1.0.0
 */
public final class ForecastOutcome implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String model;
    private final ForecastResult result;
    private final String failure;

    private ForecastOutcome(String model, ForecastResult result, String failure) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.result = result;
        this.failure = failure;
    }

    public static ForecastOutcome succeeded(ForecastResult result) {
        Objects.requireNonNull(result, "result must not be null");
        return new ForecastOutcome(result.getModel(), result, null);
    }

    public static ForecastOutcome failed(ForecastModel model, String reason) {
        return new ForecastOutcome(model.getTag(), null, Objects.requireNonNull(reason, "reason must not be null"));
    }

    public String getModel() {
        return model;
    }

    public boolean isSuccess() {
        return result != null;
    }

    /** @return the forecast, {@code null} when the strategy failed */
    public ForecastResult getResult() {
        return result;
    }

    /** @return why the strategy failed, {@code null} on success */
    public String getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        return "ForecastOutcome{model='" + model + "', " + (isSuccess() ? "ok" : "failed: " + failure) + '}';
    }
}
