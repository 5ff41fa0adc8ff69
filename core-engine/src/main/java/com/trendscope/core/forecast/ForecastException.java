package com.trendscope.core.forecast;

/**
 * A single forecasting strategy could not produce a forecast: too little
 * history, a singular fit, or non-finite output.
 *
 * <p>
 * The ensemble catches it and records the strategy as failed; it never
 * aborts the other strategies.
 * </p>
 *
 * @since 1.0.0
 */
public class ForecastException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ForecastModel model;

    public ForecastException(ForecastModel model, String message) {
        super(model.getTag() + ": " + message);
        this.model = model;
    }

    public ForecastException(ForecastModel model, String message, Throwable cause) {
        super(model.getTag() + ": " + message, cause);
        this.model = model;
    }

    public ForecastModel getModel() {
        return model;
    }
}
