package com.trendscope.core;

import com.trendscope.core.config.AnalysisConfig;
import com.trendscope.core.detection.Detector;
import com.trendscope.core.detection.DetectorKind;
import com.trendscope.core.event.EntityEventReport;
import com.trendscope.core.model.MentionRecord;
import com.trendscope.core.series.InMemoryMentionRepository;
import com.trendscope.core.series.MentionFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalysisEngine}.
 */
class AnalysisEngineTest {

    private static final LocalDate START = LocalDate.of(2024, 2, 1);

    private InMemoryMentionRepository repository;
    private AnalysisEngine engine;

    @BeforeEach
    void setUp() {
        long[] oslo = new long[20];
        for (int i = 0; i < oslo.length; i++) {
            oslo[i] = i == 12 ? 30 : 2;
        }
        List<MentionRecord> records = new ArrayList<>(MentionFixtures.daily("Oslo", START, oslo));
        records.addAll(MentionFixtures.daily("Bergen", START, 1, 1, 1));
        repository = new InMemoryMentionRepository(records);

        AnalysisConfig config = AnalysisConfig.defaults();
        config.getExecution().setParallelism(2);
        config.getAnomaly().setStrategy("z_score");
        config.getBurst().setSensitivity(2.0);
        config.getBurst().setWindowSize(3);
        config.getBurst().setMinBurstDuration(1);
        config.getBurst().setMaxBurstGap(1);
        engine = new AnalysisEngine(config, repository);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("Should wire every component from the configuration")
    void shouldWireComponents() {
        assertThat(engine.executor().getParallelism()).isEqualTo(2);
        assertThat(engine.timeSeries()).isNotNull();
        assertThat(engine.burstDetector().getWindowSize()).isEqualTo(engine.getConfig().getBurst().getWindowSize());
        assertThat(engine.correlationAnalyzer()).isNotNull();
        assertThat(engine.multiEntityEvents()).isNotNull();
        assertThat(engine.crossEntityEvents()).isNotNull();
        assertThat(engine.predictor().getNeighborWindow())
                .isEqualTo(engine.getConfig().getForecast().getPeakNeighborWindow());
        assertThat(engine.entityEvents().getMaxDaysGap()).isEqualTo(engine.getConfig().getEvents().getMaxDaysGap());
    }

    @Test
    @DisplayName("Should create one detector per family")
    void shouldCreateDetectors() {
        assertThat(engine.detectors()).extracting(Detector::kind)
                .containsExactlyInAnyOrder(DetectorKind.values());
        assertThat(engine.newAnomalyDetector()).isNotSameAs(engine.newAnomalyDetector());
    }

    @Test
    @DisplayName("Should detect the spike of an entity through the facade")
    void shouldDetectEventsThroughFacade() {
        EntityEventReport report = engine.entityEvents().detectEntityEvents("Oslo", null, null).orElseThrow();

        assertThat(report.getTotalMentions()).isEqualTo(68);
        assertThat(report.getEvents()).singleElement()
                .satisfies(event -> assertThat(event.getDate()).isEqualTo(START.plusDays(12)));
    }

    @Test
    @DisplayName("Should refuse an invalid configuration")
    void shouldRejectInvalidConfig() {
        AnalysisConfig config = AnalysisConfig.defaults();
        config.getBurst().setSensitivity(0);

        assertThatThrownBy(() -> new AnalysisEngine(config, repository))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("validation failed");
    }
}
