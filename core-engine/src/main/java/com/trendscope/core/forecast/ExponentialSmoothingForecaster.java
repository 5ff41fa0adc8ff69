package com.trendscope.core.forecast;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.concurrent.Cancellation;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;

/**
 * Additive Holt-Winters smoothing: level, trend and a seasonal component of
 * fixed period.
 *
 * <h3>Fit</h3>
 * <p>
 * The first season initialises the state: the level is its mean, the trend
 * is the per-day change between the means of the first two seasons, and the
 * seasonal terms are the first season's deviations from its mean. The
 * smoothing weights alpha, beta and gamma are chosen by Nelder-Mead to
 * minimise the squared one-step-ahead error over the rest of the history.
 * Each weight is searched through a logistic map so it stays in (0, 1).
 * </p>
 *
 * <h3>Forecast</h3>
 * <p>
 * {@code level + h * trend + season[h]}, the seasonal term taken from the
 * last full cycle.
 * </p>
 *
 * @since 1.0.0
 */
public class ExponentialSmoothingForecaster extends AbstractForecaster {

    public static final int DEFAULT_PERIOD = 7;

    private static final int MAX_EVALUATIONS = 5_000;
    private static final double[] INITIAL_WEIGHTS = {0.3, 0.1, 0.1};

    private final int period;

    public ExponentialSmoothingForecaster() {
        this(DEFAULT_PERIOD);
    }

    public ExponentialSmoothingForecaster(int period) {
        this.period = InvalidParameterException.requireAtLeast("seasonalPeriod", period, 2);
    }

    @Override
    protected double[] extrapolate(double[] values, int horizon) {
        if (values.length < 2 * period) {
            throw insufficient(2 * period, values.length);
        }

        double[] start = new double[INITIAL_WEIGHTS.length];
        for (int k = 0; k < start.length; k++) {
            start[k] = logit(INITIAL_WEIGHTS[k]);
        }
        PointValuePair best;
        try {
            SimplexOptimizer optimizer = new SimplexOptimizer(1e-10, 1e-12);
            best = optimizer.optimize(
                    new MaxEval(MAX_EVALUATIONS),
                    new ObjectiveFunction(point -> {
                        Cancellation.checkpoint();
                        return smooth(values, weights(point)).squaredError;
                    }),
                    GoalType.MINIMIZE,
                    new InitialGuess(start),
                    new NelderMeadSimplex(start.length));
        } catch (TooManyEvaluationsException e) {
            throw new ForecastException(model(), "smoothing weights did not converge", e);
        }

        State state = smooth(values, weights(best.getPoint()));
        double[] predictions = new double[horizon];
        int n = values.length;
        for (int h = 1; h <= horizon; h++) {
            double season = state.seasonal[n - period + (h - 1) % period];
            predictions[h - 1] = state.level + h * state.trend + season;
        }
        return predictions;
    }

    /** Runs the recursions once; package-private so the fit can be inspected. */
    State smooth(double[] values, double[] weights) {
        double alpha = weights[0];
        double beta = weights[1];
        double gamma = weights[2];
        int n = values.length;

        double firstMean = 0;
        double secondMean = 0;
        for (int i = 0; i < period; i++) {
            firstMean += values[i];
            secondMean += values[i + period];
        }
        firstMean /= period;
        secondMean /= period;

        double[] seasonal = new double[n];
        for (int i = 0; i < period; i++) {
            seasonal[i] = values[i] - firstMean;
        }
        double level = firstMean;
        double trend = (secondMean - firstMean) / period;
        double squaredError = 0;

        for (int t = period; t < n; t++) {
            double previousSeason = seasonal[t - period];
            double predicted = level + trend + previousSeason;
            double error = values[t] - predicted;
            squaredError += error * error;

            double previousLevel = level;
            level = alpha * (values[t] - previousSeason) + (1 - alpha) * (level + trend);
            trend = beta * (level - previousLevel) + (1 - beta) * trend;
            seasonal[t] = gamma * (values[t] - level) + (1 - gamma) * previousSeason;
        }
        return new State(level, trend, seasonal, squaredError);
    }

    private static double[] weights(double[] point) {
        double[] weights = new double[point.length];
        for (int k = 0; k < point.length; k++) {
            weights[k] = 1.0 / (1.0 + Math.exp(-point[k]));
        }
        return weights;
    }

    private static double logit(double p) {
        return Math.log(p / (1 - p));
    }

    @Override
    public ForecastModel model() {
        return ForecastModel.EXPONENTIAL_SMOOTHING;
    }

    public int getPeriod() {
        return period;
    }

    static final class State {
        final double level;
        final double trend;
        final double[] seasonal;
        final double squaredError;

        State(double level, double trend, double[] seasonal, double squaredError) {
            this.level = level;
            this.trend = trend;
            this.seasonal = seasonal;
            this.squaredError = squaredError;
        }
    }
}
