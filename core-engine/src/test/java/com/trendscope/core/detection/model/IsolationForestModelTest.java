package com.trendscope.core.detection.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IsolationForestModel}.
 */
class IsolationForestModelTest {

    private IsolationForestModel model;

    @BeforeEach
    void setUp() {
        model = new IsolationForestModel(0.05, 42L);
    }

    @Test
    @DisplayName("Should give the far-away row the lowest decision value")
    void shouldRankOutlierLowest() {
        double[][] rows = OutlierModelFixtures.clusterWithOutlier();
        model.fit(rows);

        double[] decisions = model.decisionFunction(rows);

        assertThat(decisions).hasSize(rows.length);
        assertThat(OutlierModelFixtures.argMin(decisions)).isEqualTo(OutlierModelFixtures.OUTLIER);
        assertThat(decisions[OutlierModelFixtures.OUTLIER]).isNegative();
    }

    @Test
    @DisplayName("Should reject rows of another width than the training rows")
    void shouldRejectOtherWidth() {
        model.fit(OutlierModelFixtures.clusterWithOutlier());

        assertThat(model.featureCount()).isEqualTo(2);
        assertThatThrownBy(() -> model.decisionFunction(new double[][] { { 1.0, 2.0, 3.0 } }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("trained on 2 features");
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
