package com.trendscope.core.forecast;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.model.EntityTimeSeries;
import com.trendscope.core.model.ModelEvaluation;
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
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ModelEvaluator}.
 */
class ModelEvaluatorTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private ModelEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new ModelEvaluator();
    }

    @Test
    @DisplayName("Should skip a series shorter than thirty days")
    void shouldSkipShortSeries() {
        long[] counts = new long[29];
        Arrays.fill(counts, 3);

        assertThat(evaluator.evaluate(EntityTimeSeries.ofCounts("Oslo", START, counts))).isEmpty();
    }

    @Test
    @DisplayName("Should cross-validate every regressor over five folds")
    void shouldEvaluateAllModels() {
        Random random = new Random(7);
        long[] counts = new long[40];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = 5 + random.nextInt(20);
        }

        Map<String, ModelEvaluation> results = evaluator.evaluate(EntityTimeSeries.ofCounts("Oslo", START, counts));

        assertThat(results.keySet()).containsExactly("linear_regression", "random_forest", "svr");
        assertThat(results.values()).allSatisfy(evaluation -> {
            assertThat(evaluation.getFolds()).isEqualTo(ModelEvaluator.DEFAULT_FOLDS);
            assertThat(evaluation.getMse()).isGreaterThanOrEqualTo(0.0);
            assertThat(evaluation.getMae()).isGreaterThanOrEqualTo(0.0);
            assertThat(evaluation.getMse()).isGreaterThanOrEqualTo(evaluation.getMae() * evaluation.getMae() - 1e-9);
        });
    }

    @Test
    @DisplayName("Should score a perfectly predicted constant series with zero error")
    void shouldScoreConstantSeries() {
        long[] counts = new long[35];
        Arrays.fill(counts, 4);

        ModelEvaluation forest = evaluator.evaluate(EntityTimeSeries.ofCounts("Oslo", START, counts))
                .get("random_forest");

        assertThat(forest).isNotNull();
        assertThat(forest.getMse()).isCloseTo(0.0, within(1e-12));
        assertThat(forest.getR2()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should compute the error metrics")
    void shouldComputeMetrics() {
        double[] actual = { 1, 2, 3 };
        double[] predicted = { 1, 2, 5 };

        assertThat(ModelEvaluator.meanSquaredError(actual, predicted)).isCloseTo(4.0 / 3.0, within(1e-12));
        assertThat(ModelEvaluator.meanAbsoluteError(actual, predicted)).isCloseTo(2.0 / 3.0, within(1e-12));
        assertThat(ModelEvaluator.rSquared(actual, predicted)).isCloseTo(-1.0, within(1e-12));
    }

    @Test
    @DisplayName("Should score R squared of a constant target by exactness")
    void shouldHandleConstantTarget() {
        double[] actual = { 2, 2 };

        assertThat(ModelEvaluator.rSquared(actual, new double[] { 2, 2 })).isEqualTo(1.0);
        assertThat(ModelEvaluator.rSquared(actual, new double[] { 2, 3 })).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should stop between folds when the thread is interrupted")
    void shouldStopWhenInterrupted() {
        long[] counts = new long[35];
        Arrays.fill(counts, 6);
        EntityTimeSeries series = EntityTimeSeries.ofCounts("Oslo", START, counts);

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> evaluator.evaluate(series)).isInstanceOf(CancellationException.class);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("Should reject fewer than two folds")
    void shouldRejectSingleFold() {
        assertThatThrownBy(() -> new ModelEvaluator(1))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("folds");
    }
}
