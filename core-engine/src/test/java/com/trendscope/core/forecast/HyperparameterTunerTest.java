package com.trendscope.core.forecast;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.model.EntityTimeSeries;
import com.trendscope.core.model.ForecastResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HyperparameterTuner}.
 */
class HyperparameterTunerTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private HyperparameterTuner tuner;
    private EntityTimeSeries series;

    @BeforeEach
    void setUp() {
        tuner = new HyperparameterTuner(3, 3, 42L);
        series = noisyTrend(40, 7L);
    }

    @Test
    @DisplayName("Should not tune a series shorter than thirty days")
    void shouldSkipShortSeries() {
        long[] counts = new long[29];
        Arrays.fill(counts, 4);
        EntityTimeSeries shortSeries = EntityTimeSeries.ofCounts("Oslo", START, counts);

        assertThat(tuner.tuneAllModels(shortSeries).isEmpty()).isTrue();
        assertThat(tuner.tuneAllModels(shortSeries).getBest()).isEmpty();
        assertThat(tuner.tuneLinearModels(shortSeries)).isEmpty();
    }

    @Test
    @DisplayName("Should tune every family and pick the lowest error as best")
    void shouldTuneAllModels() {
        TuningResult result = tuner.tuneAllModels(series);

        assertThat(result.getModels()).containsKeys("ridge", "random_forest", "svr");
        assertThat(result.getModels().keySet())
                .isSubsetOf("ridge", "lasso", "elastic_net", "random_forest", "gradient_boosting", "svr");
        TunedModel best = result.getBest().orElseThrow();
        assertThat(result.getModels().values())
                .allSatisfy(model -> assertThat(best.getMse()).isLessThanOrEqualTo(model.getMse()));
        assertThat(result.getModels().get("ridge").getFamily()).isEqualTo(ForecastModel.LINEAR_REGRESSION);
    }

    @Test
    @DisplayName("Should choose penalized linear parameters from their grids")
    void shouldTuneLinearModels() {
        Map<String, TunedModel> linear = tuner.tuneLinearModels(series);

        TunedModel ridge = linear.get("ridge");
        assertThat(ridge.getParams()).containsOnlyKeys("alpha");
        assertThat(Arrays.stream(HyperparameterTuner.ALPHAS).boxed())
                .contains((Double) ridge.getParams().get("alpha"));
        assertThat(ridge.getMse()).isFinite().isGreaterThanOrEqualTo(0.0);
        assertThat(linear.keySet()).isSubsetOf("ridge", "lasso", "elastic_net");
        TunedModel elasticNet = linear.get("elastic_net");
        if (elasticNet != null) {
            assertThat(elasticNet.getParams()).containsOnlyKeys("alpha", "l1_ratio");
        }
    }

    @Test
    @DisplayName("Should sample tree ensemble parameters from their grids")
    void shouldTuneTreeEnsembles() {
        Map<String, TunedModel> trees = tuner.tuneTreeModels(series);

        TunedModel forest = trees.get("random_forest");
        assertThat(forest.getParams()).containsOnlyKeys("trees", "max_depth", "node_size");
        assertThat(Arrays.stream(HyperparameterTuner.FOREST_TREES).boxed())
                .contains((Integer) forest.getParams().get("trees"));
        assertThat(Arrays.stream(HyperparameterTuner.FOREST_DEPTHS).boxed())
                .contains((Integer) forest.getParams().get("max_depth"));
        TunedModel boosting = trees.get("gradient_boosting");
        assertThat(boosting.getParams()).containsOnlyKeys("trees", "learning_rate", "max_depth", "node_size",
                "subsample");
        assertThat(Arrays.stream(HyperparameterTuner.BOOSTING_RATES).boxed())
                .contains((Double) boosting.getParams().get("learning_rate"));
    }

    @Test
    @DisplayName("Should sample the same support vector candidates for the same seed")
    void shouldBeDeterministicForSeed() {
        TunedModel first = tuner.tuneSvrModel(series).get("svr");
        TunedModel second = new HyperparameterTuner(3, 3, 42L).tuneSvrModel(series).get("svr");

        assertThat(first.getParams()).isEqualTo(second.getParams());
        assertThat(first.getMse()).isEqualTo(second.getMse());
        assertThat(first.getParams()).containsKeys("kernel", "C", "epsilon");
    }

    @Test
    @DisplayName("Should forecast with a tuned model and clamp at zero")
    void shouldPredictWithTunedModel() {
        TunedModel ridge = tuner.tuneLinearModels(decline()).get("ridge");

        ForecastResult forecast = tuner.predictWithTunedModel(ridge, decline(), 5);

        assertThat(forecast.getModel()).isEqualTo("ridge");
        assertThat(forecast.getValues()).hasSize(5);
        assertThat(forecast.getValues().firstKey()).isEqualTo(START.plusDays(40));
        assertThat(forecast.getValues().values()).allSatisfy(value -> assertThat(value).isGreaterThanOrEqualTo(0.0));
    }

    @Test
    @DisplayName("Should stop tuning when the thread is interrupted")
    void shouldStopWhenInterrupted() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> tuner.tuneAllModels(series)).isInstanceOf(CancellationException.class);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("Should reject fewer than one iteration")
    void shouldRejectIterations() {
        assertThatThrownBy(() -> new HyperparameterTuner(3, 0, 42L))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("iterations");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static EntityTimeSeries noisyTrend(int days, long seed) {
        Random random = new Random(seed);
        long[] counts = new long[days];
        for (int i = 0; i < days; i++) {
            counts[i] = 10 + i / 2 + random.nextInt(6);
        }
        return EntityTimeSeries.ofCounts("Oslo", START, counts);
    }

    private static EntityTimeSeries decline() {
        Random random = new Random(3L);
        long[] counts = new long[40];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = Math.max(0, 80 - 2 * i + random.nextInt(3));
        }
        return EntityTimeSeries.ofCounts("Oslo", START, counts);
    }
}
