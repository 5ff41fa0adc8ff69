package com.trendscope.core.detection;

import com.trendscope.core.config.AnalysisConfig;
import com.trendscope.core.model.DetectionMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    private AnalysisConfig config;

    @BeforeEach
    void setUp() {
        config = AnalysisConfig.defaults();
        config.getAnomaly().setStrategy("iqr");
        config.getAnomaly().setChangePointWindow(5);
        config.getBurst().setSensitivity(2.5);
    }

    @Test
    @DisplayName("Should create AnomalyDetector with the configured strategy")
    void shouldCreateAnomalyDetector() {
        Detector detector = DetectorFactory.create(DetectorKind.ANOMALY, config);

        assertThat(detector).isInstanceOf(AnomalyDetector.class);
        assertThat(detector.method()).isEqualTo(DetectionMethod.IQR);
    }

    @Test
    @DisplayName("Should create BurstDetector from the burst section")
    void shouldCreateBurstDetector() {
        Detector detector = DetectorFactory.create(DetectorKind.BURST, config);

        assertThat(detector).isInstanceOf(BurstDetector.class);
        assertThat(((BurstDetector) detector).getSensitivity()).isEqualTo(2.5);
    }

    @Test
    @DisplayName("Should create ChangePointDetector with the configured window")
    void shouldCreateChangePointDetector() {
        Detector detector = DetectorFactory.create(DetectorKind.CHANGE_POINT, config);

        assertThat(detector).isInstanceOf(ChangePointDetector.class);
        assertThat(((ChangePointDetector) detector).getWindowSize()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should create SeasonalDetector for kind=SEASONAL")
    void shouldCreateSeasonalDetector() {
        Detector detector = DetectorFactory.create(DetectorKind.SEASONAL, config);

        assertThat(detector).isInstanceOf(SeasonalDetector.class);
        assertThat(detector.kind()).isEqualTo(DetectorKind.SEASONAL);
    }

    @Test
    @DisplayName("Should create one unmodifiable detector per kind")
    void shouldCreateAll() {
        List<Detector> detectors = DetectorFactory.createAll(config);

        assertThat(detectors).extracting(Detector::kind).containsExactly(DetectorKind.values());
        assertThatThrownBy(() -> detectors.add(detectors.get(0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should throw for a null kind")
    void shouldThrowForNullKind() {
        assertThatThrownBy(() -> DetectorFactory.create(null, config))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("DetectorKind");
    }
}
