package com.trendscope.core.forecast.model;

import com.trendscope.core.InvalidParameterException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RandomForestRegressor} and
 * {@link GradientBoostingRegressor}.
 */
class RandomForestRegressorTest {

    private double[][] rows;
    private double[] targets;

    @BeforeEach
    void setUp() {
        rows = new double[20][];
        targets = new double[20];
        for (int i = 0; i < 20; i++) {
            rows[i] = new double[] { i, i % 2 };
            targets[i] = i < 10 ? 1.0 : 9.0;
        }
    }

    @Test
    @DisplayName("Should keep predictions inside the target range")
    void shouldAverageTrees() {
        RandomForestRegressor forest = new RandomForestRegressor(25, 4, 2, 42L);
        forest.fit(rows, targets);

        double low = forest.predict(new double[] { 0, 0 });
        double high = forest.predict(new double[] { 19, 1 });
        assertThat(low).isBetween(1.0, 9.0);
        assertThat(high).isBetween(1.0, 9.0);
        assertThat(low).isLessThan(high);
        assertThat(forest.getTreeCount()).isEqualTo(25);
    }

    @Test
    @DisplayName("Should give the same forest for the same seed")
    void shouldBeDeterministicForSeed() {
        RandomForestRegressor first = new RandomForestRegressor(10, 3, 2, 7L);
        RandomForestRegressor second = new RandomForestRegressor(10, 3, 2, 7L);
        first.fit(rows, targets);
        second.fit(rows, targets);

        for (int x = 0; x < 20; x++) {
            double[] row = { x, x % 2 };
            assertThat(first.predict(row)).isEqualTo(second.predict(row));
        }
    }

    @Test
    @DisplayName("Should boost toward both levels of a step")
    void shouldFitBoostedTrees() {
        GradientBoostingRegressor boosting = new GradientBoostingRegressor(50, 0.1, 3, 2, 1.0, 42L);
        boosting.fit(rows, targets);

        assertThat(boosting.predict(new double[] { 2, 0 })).isLessThan(5.0);
        assertThat(boosting.predict(new double[] { 17, 1 })).isGreaterThan(5.0);
        assertThat(boosting.getTreeCount()).isEqualTo(50);
    }

    @Test
    @DisplayName("Should reject a boosting learning rate outside (0, 1]")
    void shouldRejectLearningRate() {
        assertThatThrownBy(() -> new GradientBoostingRegressor(10, 0.0, 3, 2, 1.0, 1L))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("learningRate");
    }

    @Test
    @DisplayName("Should refuse to predict before fitting")
    void shouldRequireFit() {
        assertThatThrownBy(() -> new RandomForestRegressor(1L).predict(new double[] { 1, 0 }))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should reject a row of another width")
    void shouldRejectOtherWidth() {
        RandomForestRegressor forest = new RandomForestRegressor(5, 3, 2, 1L);
        forest.fit(rows, targets);

        assertThatThrownBy(() -> forest.predict(new double[] { 1 }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("trained on 2 features");
    }

    @Test
    @DisplayName("Should reject mismatched rows and targets")
    void shouldRejectShapeMismatch() {
        assertThatThrownBy(() -> new RandomForestRegressor(1L).fit(rows, new double[] { 1, 2 }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("20 rows but 2 targets");
        assertThatThrownBy(() -> new RandomForestRegressor(10, 1, 2, 1L))
                .isInstanceOf(InvalidParameterException.class);
    }
}
