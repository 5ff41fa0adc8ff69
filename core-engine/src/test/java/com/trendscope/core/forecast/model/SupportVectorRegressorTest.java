package com.trendscope.core.forecast.model;

import com.trendscope.core.InvalidParameterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SupportVectorRegressor}, {@link PenalizedRegressor}
 * and {@link LinearRegressor}.
 */
class SupportVectorRegressorTest {

    @Test
    @DisplayName("Should predict a constant target within the tube")
    void shouldFitConstantTarget() {
        double[][] rows = new double[12][];
        double[] targets = new double[12];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = new double[] { i, i % 3 };
            targets[i] = 5.0;
        }
        SupportVectorRegressor svr = new SupportVectorRegressor();
        svr.fit(rows, targets);

        assertThat(svr.predict(new double[] { 4, 1 })).isCloseTo(5.0, within(0.2));
    }

    @Test
    @DisplayName("Should follow a linear relation with the linear kernel")
    void shouldFitLinearKernel() {
        double[][] rows = linearRows();
        double[] targets = linearTargets(rows);
        SupportVectorRegressor svr = new SupportVectorRegressor(SupportVectorRegressor.Kernel.LINEAR, 10.0, 0.05,
                Double.NaN);
        svr.fit(rows, targets);

        assertThat(svr.predict(new double[] { 10 })).isCloseTo(1.0, within(0.3));
        assertThat(svr.getKernel()).isEqualTo(SupportVectorRegressor.Kernel.LINEAR);
    }

    @Test
    @DisplayName("Should follow a gentle linear relation inside the training range")
    void shouldFitRbfKernel() {
        double[][] rows = linearRows();
        SupportVectorRegressor svr = new SupportVectorRegressor();
        svr.fit(rows, linearTargets(rows));

        assertThat(svr.predict(new double[] { 10 })).isCloseTo(1.0, within(0.3));
    }

    @Test
    @DisplayName("Should shrink ridge coefficients toward the mean")
    void shouldFitRidge() {
        double[][] rows = linearRows();
        double[] targets = linearTargets(rows);
        PenalizedRegressor light = PenalizedRegressor.ridge(0.01);
        PenalizedRegressor heavy = PenalizedRegressor.ridge(1e6);
        light.fit(rows, targets);
        heavy.fit(rows, targets);

        assertThat(light.predict(new double[] { 20 })).isCloseTo(2.0, within(0.05));
        // a huge penalty flattens the fit to the target mean
        assertThat(heavy.predict(new double[] { 20 })).isCloseTo(1.0, within(0.1));
    }

    @Test
    @DisplayName("Should fit a linear relation with lasso and elastic net")
    void shouldFitSparsePenalties() {
        double[][] rows = linearRows();
        double[] targets = linearTargets(rows);
        PenalizedRegressor lasso = PenalizedRegressor.lasso(0.01);
        PenalizedRegressor elasticNet = PenalizedRegressor.elasticNet(0.01, 0.5);
        lasso.fit(rows, targets);
        elasticNet.fit(rows, targets);

        assertThat(lasso.predict(new double[] { 10 })).isCloseTo(1.0, within(0.1));
        assertThat(elasticNet.predict(new double[] { 10 })).isCloseTo(1.0, within(0.1));
        assertThat(elasticNet.getPenalty()).isEqualTo(PenalizedRegressor.Penalty.ELASTIC_NET);
    }

    @Test
    @DisplayName("Should recover exact least-squares coefficients")
    void shouldFitLinearRegressor() {
        double[][] rows = { { 0, 0 }, { 1, 0 }, { 0, 1 }, { 2, 3 }, { 3, 1 }, { 1, 4 } };
        double[] targets = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            targets[i] = 2 * rows[i][0] - rows[i][1] + 3;
        }
        LinearRegressor regressor = new LinearRegressor();
        regressor.fit(rows, targets);

        assertThat(regressor.predict(new double[] { 4, 1 })).isCloseTo(10.0, within(1e-9));
        assertThat(regressor.predict(new double[][] { { 0, 0 }, { 1, 1 } }))
                .containsExactly(new double[] { 3.0, 4.0 }, within(1e-9));
    }

    @Test
    @DisplayName("Should refuse to predict before fitting")
    void shouldRequireFit() {
        assertThatThrownBy(() -> new SupportVectorRegressor().predict(new double[] { 1 }))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> PenalizedRegressor.ridge(1.0).predict(new double[] { 1 }))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new LinearRegressor().predict(new double[] { 1 }))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should reject fitting on no rows")
    void shouldRejectEmptyTrainingSet() {
        assertThatThrownBy(() -> new SupportVectorRegressor().fit(new double[0][], new double[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no rows");
    }

    @Test
    @DisplayName("Should reject a non-positive penalty")
    void shouldRejectPenalty() {
        assertThatThrownBy(() -> new SupportVectorRegressor(SupportVectorRegressor.Kernel.RBF, 0.0, 0.1, Double.NaN))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("C");
        assertThatThrownBy(() -> PenalizedRegressor.ridge(-1.0))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> PenalizedRegressor.elasticNet(1.0, 1.0))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("l1Ratio");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static double[][] linearRows() {
        double[][] rows = new double[21][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = new double[] { i };
        }
        return rows;
    }

    private static double[] linearTargets(double[][] rows) {
        double[] targets = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            targets[i] = 0.1 * rows[i][0];
        }
        return targets;
    }
}
