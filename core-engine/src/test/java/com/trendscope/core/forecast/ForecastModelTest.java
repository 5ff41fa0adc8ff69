package com.trendscope.core.forecast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ForecastModel}.
 */
class ForecastModelTest {

    @Test
    @DisplayName("Should resolve tags ignoring case and surrounding blanks")
    void shouldResolveTags() {
        assertThat(ForecastModel.fromTag("arima")).isEqualTo(ForecastModel.ARIMA);
        assertThat(ForecastModel.fromTag(" Random_Forest ")).isEqualTo(ForecastModel.RANDOM_FOREST);
        assertThat(ForecastModel.fromTag("SVR")).isEqualTo(ForecastModel.SVR);
    }

    @Test
    @DisplayName("Should reject an unknown tag")
    void shouldRejectUnknownTag() {
        assertThatThrownBy(() -> ForecastModel.fromTag("prophet"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown forecast model 'prophet'");
    }

    @Test
    @DisplayName("Should create a forecaster reporting its own model")
    void shouldCreateMatchingForecaster() {
        for (ForecastModel model : ForecastModel.values()) {
            assertThat(model.newForecaster().model()).isEqualTo(model);
            assertThat(model.toString()).isEqualTo(model.getTag());
        }
    }
}
