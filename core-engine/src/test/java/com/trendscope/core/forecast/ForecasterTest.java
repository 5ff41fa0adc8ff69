package com.trendscope.core.forecast;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.model.EntityTimeSeries;
import com.trendscope.core.model.ForecastResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for the individual {@link Forecaster} strategies.
 */
class ForecasterTest {

    private static final LocalDate START = LocalDate.of(2024, 3, 1);
    private static final long[] WEEK = { 2, 4, 6, 8, 6, 4, 2 };

    @Test
    @DisplayName("Should extend a straight line past the last day")
    void shouldExtendLinearTrend() {
        ForecastResult result = new LinearTrendForecaster()
                .forecast(EntityTimeSeries.ofCounts("Oslo", START, 1, 2, 3, 4), 2);

        assertThat(result.getModel()).isEqualTo("linear_regression");
        assertThat(result.getValues().keySet()).containsExactly(START.plusDays(4), START.plusDays(5));
        assertThat(result.getValues().get(START.plusDays(4))).isCloseTo(5.0, within(1e-9));
        assertThat(result.getValues().get(START.plusDays(5))).isCloseTo(6.0, within(1e-9));
    }

    @Test
    @DisplayName("Should clamp a declining trend at zero")
    void shouldClampNegativePredictions() {
        ForecastResult result = new LinearTrendForecaster()
                .forecast(EntityTimeSeries.ofCounts("Oslo", START, 10, 8, 6, 4, 2), 3);

        assertThat(result.getValues()).hasSize(3);
        assertThat(result.getValues().values()).allSatisfy(v -> assertThat(v).isCloseTo(0.0, within(1e-9)));
        assertThat(result.getValues().values()).allSatisfy(v -> assertThat(v).isGreaterThanOrEqualTo(0.0));
    }

    @Test
    @DisplayName("Should require two days of history for a linear trend")
    void shouldRejectSingleDayForLinearTrend() {
        assertThatThrownBy(() -> new LinearTrendForecaster()
                .forecast(EntityTimeSeries.ofCounts("Oslo", START, 5), 1))
                .isInstanceOf(ForecastException.class)
                .hasMessageContaining("needs at least 2 days of history, got 1");
    }

    @Test
    @DisplayName("Should require twelve days of history for ARIMA")
    void shouldRejectShortHistoryForArima() {
        assertThatThrownBy(() -> new ArimaForecaster().forecast(series(periodic(11)), 3))
                .isInstanceOf(ForecastException.class)
                .hasMessageContaining("arima")
                .hasMessageContaining("needs at least 12 days");
    }

    @Test
    @DisplayName("Should forecast with ARIMA once enough history is available")
    void shouldForecastWithArima() {
        long[] counts = new long[30];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = 10 + (i % 3) + (i % 5);
        }
        ForecastResult result = new ArimaForecaster().forecast(series(counts), 5);

        assertThat(result.getValues()).hasSize(5);
        assertThat(result.getValues().firstKey()).isEqualTo(START.plusDays(30));
        assertThat(result.getValues().values()).allSatisfy(v -> assertThat(v).isGreaterThanOrEqualTo(0.0));
    }

    @Test
    @DisplayName("Should require two seasonal periods for Holt-Winters")
    void shouldRejectShortHistoryForExponentialSmoothing() {
        assertThatThrownBy(() -> new ExponentialSmoothingForecaster().forecast(series(periodic(13)), 3))
                .isInstanceOf(ForecastException.class)
                .hasMessageContaining("needs at least 14 days");
    }

    @Test
    @DisplayName("Should continue an exactly weekly pattern with Holt-Winters")
    void shouldReproduceWeeklyPattern() {
        ForecastResult result = new ExponentialSmoothingForecaster().forecast(series(periodic(28)), 7);

        List<Double> values = new ArrayList<>(result.getValues().values());
        assertThat(values).hasSize(7);
        for (int h = 0; h < 7; h++) {
            assertThat(values.get(h)).isCloseTo((double) WEEK[h], within(1e-6));
        }
    }

    @Test
    @DisplayName("Should require ten lag rows for the random forest and SVR")
    void shouldRejectShortHistoryForLagModels() {
        assertThatThrownBy(() -> new TreeEnsembleForecaster().forecast(series(periodic(16)), 3))
                .isInstanceOf(ForecastException.class)
                .hasMessageContaining("needs at least 17 days");
        assertThatThrownBy(() -> new KernelSvrForecaster().forecast(series(periodic(16)), 3))
                .isInstanceOf(ForecastException.class)
                .hasMessageContaining("needs at least 17 days");
    }

    @Test
    @DisplayName("Should forecast recursively with the lag regression models")
    void shouldForecastWithLagModels() {
        EntityTimeSeries history = series(periodic(35));
        for (Forecaster forecaster : List.of(new TreeEnsembleForecaster(), new KernelSvrForecaster())) {
            ForecastResult result = forecaster.forecast(history, 10);

            assertThat(result.getModel()).isEqualTo(forecaster.model().getTag());
            assertThat(result.getValues()).hasSize(10);
            assertThat(result.getValues().firstKey()).isEqualTo(START.plusDays(35));
            assertThat(result.getValues().lastKey()).isEqualTo(START.plusDays(44));
            assertThat(result.getValues().values()).allSatisfy(v -> assertThat(v).isBetween(0.0, 20.0));
        }
    }

    @Test
    @DisplayName("Should reject a horizon below one day")
    void shouldRejectZeroHorizon() {
        assertThatThrownBy(() -> new LinearTrendForecaster().forecast(series(periodic(7)), 0))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("horizon");
    }

    @Test
    @DisplayName("Should reject an empty history")
    void shouldRejectEmptyHistory() {
        assertThatThrownBy(() -> new ArimaForecaster().forecast(EntityTimeSeries.empty("Oslo"), 3))
                .isInstanceOf(ForecastException.class)
                .hasMessageContaining("history is empty");
    }

    @Test
    @DisplayName("Should stop fitting on an interrupted thread")
    void shouldStopWhenInterrupted() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> new ArimaForecaster().forecast(series(periodic(28)), 3))
                    .isInstanceOf(CancellationException.class);
            assertThatThrownBy(() -> new LinearTrendForecaster().forecast(series(periodic(28)), 3))
                    .isInstanceOf(CancellationException.class);
        } finally {
            Thread.interrupted();
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static long[] periodic(int days) {
        long[] counts = new long[days];
        for (int i = 0; i < days; i++) {
            counts[i] = WEEK[i % WEEK.length];
        }
        return counts;
    }

    private static EntityTimeSeries series(long[] counts) {
        return EntityTimeSeries.ofCounts("Oslo", START, counts);
    }
}
