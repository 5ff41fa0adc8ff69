package com.trendscope.core.detection.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link OneClassSvm}.
 */
class OneClassSvmTest {

    private OneClassSvm model;

    @BeforeEach
    void setUp() {
        model = new OneClassSvm(0.05);
    }

    @Test
    @DisplayName("Should give a row far from the training cluster the lowest decision value")
    void shouldRankNovelRowLowest() {
        double[][] rows = OutlierModelFixtures.clusterWithOutlier();
        model.fit(Arrays.copyOf(rows, OutlierModelFixtures.OUTLIER));

        double[] decisions = model.decisionFunction(rows);

        assertThat(decisions).hasSize(rows.length);
        assertThat(OutlierModelFixtures.argMin(decisions)).isEqualTo(OutlierModelFixtures.OUTLIER);
        assertThat(decisions[OutlierModelFixtures.OUTLIER]).isNegative();
        assertThat(model.getGamma()).isPositive();
    }

    @Test
    @DisplayName("Should refuse to score before fitting")
    void shouldRequireFit() {
        assertThat(model.isFitted()).isFalse();
        assertThatThrownBy(() -> model.decisionFunction(new double[][] { { 1.0 } }))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should need at least two training rows")
    void shouldRejectSingleRow() {
        assertThatThrownBy(() -> model.fit(new double[][] { { 1.0, 2.0 } }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 2 rows");
    }
}
