package com.trendscope.core.event;

import com.trendscope.core.EntityNotFoundException;
import com.trendscope.core.concurrent.AnalysisExecutor;
import com.trendscope.core.config.AnomalySettings;
import com.trendscope.core.detection.BurstDetector;
import com.trendscope.core.detection.DetectorKind;
import com.trendscope.core.model.CombinedEvent;
import com.trendscope.core.model.DetectionMethod;
import com.trendscope.core.model.MentionRecord;
import com.trendscope.core.series.InMemoryMentionRepository;
import com.trendscope.core.series.MentionFixtures;
import com.trendscope.core.series.TimeSeriesProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EntityEventDetector}.
 */
class EntityEventDetectorTest {

    private static final LocalDate START = LocalDate.of(2024, 6, 3);

    private TimeSeriesProvider provider;
    private AnomalySettings anomalySettings;
    private EntityEventDetector detector;

    @BeforeEach
    void setUp() {
        long[] counts = new long[20];
        Arrays.fill(counts, 2);
        counts[12] = 30;
        List<MentionRecord> records = new ArrayList<>(MentionFixtures.daily("Oslo", START, counts));
        records.addAll(MentionFixtures.daily("Bergen", START, 1, 1, 1));
        provider = new TimeSeriesProvider(new InMemoryMentionRepository(records));

        anomalySettings = new AnomalySettings();
        anomalySettings.setStrategy("z_score");
        detector = new EntityEventDetector(provider, anomalySettings, new BurstDetector(2.0, 3, 1, 1), 3, null);
    }

    // ------------------------------------------------------------------
    // Merging
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should merge nearby detections and average the best score of each method")
    void shouldCombineNearbyDetections() {
        List<RawDetection> detections = List.of(
                new RawDetection(day(0), 8, 4.0, DetectionMethod.Z_SCORE, "anomaly"),
                new RawDetection(day(10), 9, 3.0, DetectionMethod.CHANGE_POINT, "shift"),
                new RawDetection(day(1), 12, 6.0, DetectionMethod.BURST, "burst"),
                new RawDetection(day(1), 12, 2.0, DetectionMethod.Z_SCORE, "anomaly again"));

        List<CombinedEvent> events = EntityEventDetector.combineEvents("Oslo", detections, 3);

        assertThat(events).hasSize(2);
        CombinedEvent first = events.get(0);
        assertThat(first.getDate()).isEqualTo(day(1));
        assertThat(first.getValue()).isEqualTo(12.0);
        assertThat(first.getDescription()).isEqualTo("burst");
        assertThat(first.getMethods()).containsExactlyInAnyOrder(DetectionMethod.Z_SCORE, DetectionMethod.BURST);
        assertThat(first.getScore()).isEqualTo(5.0);
        assertThat(events.get(1).getDate()).isEqualTo(day(10));
        assertThat(events.get(1).getScore()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should join a detection exactly max gap days after the group")
    void shouldJoinAtGapBoundary() {
        List<RawDetection> atGap = List.of(
                new RawDetection(day(0), 5, 3.5, DetectionMethod.BURST, "x"),
                new RawDetection(day(3), 5, 3.5, DetectionMethod.BURST, "y"));
        List<RawDetection> beyondGap = List.of(
                new RawDetection(day(0), 5, 3.5, DetectionMethod.BURST, "x"),
                new RawDetection(day(4), 5, 3.5, DetectionMethod.BURST, "y"));

        assertThat(EntityEventDetector.combineEvents("Oslo", atGap, 3)).hasSize(1);
        assertThat(EntityEventDetector.combineEvents("Oslo", beyondGap, 3)).hasSize(2);
    }

    @Test
    @DisplayName("Should return no events for no detections")
    void shouldCombineNothing() {
        assertThat(EntityEventDetector.combineEvents("Oslo", List.of(), 3)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Detection
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should report the spike as one event found by every method")
    void shouldDetectEntityEvents() {
        EntityEventReport report = detector.detectEntityEvents("Oslo", null, null).orElseThrow();

        assertThat(report.getTotalMentions()).isEqualTo(19 * 2 + 30);
        assertThat(report.getMaxDailyMentions()).isEqualTo(30);
        assertThat(report.getAnomalyEvents()).extracting(RawDetection::getDate).containsExactly(day(12));
        assertThat(report.getBurstEvents()).extracting(RawDetection::getDate).containsExactly(day(12));
        assertThat(report.getChangePointEvents()).isNotEmpty();
        assertThat(report.getEvents()).hasSize(1);
        CombinedEvent event = report.getEvents().get(0);
        assertThat(event.getDate()).isEqualTo(day(12));
        assertThat(event.getValue()).isEqualTo(30.0);
        assertThat(event.getMethods()).containsExactlyInAnyOrder(
                DetectionMethod.Z_SCORE, DetectionMethod.BURST, DetectionMethod.CHANGE_POINT);
    }

    @Test
    @DisplayName("Should run only the requested detectors")
    void shouldRespectRequestedMethods() {
        EntityEventReport report = detector.detectEntityEvents("Oslo", null, null,
                EnumSet.of(DetectorKind.BURST)).orElseThrow();

        assertThat(report.getAnomalyEvents()).isEmpty();
        assertThat(report.getChangePointEvents()).isEmpty();
        assertThat(report.getEvents()).singleElement()
                .satisfies(e -> assertThat(e.getMethods()).containsExactly(DetectionMethod.BURST));
    }

    @Test
    @DisplayName("Should return empty when the entity has no mentions in range")
    void shouldReturnEmptyOutsideRange() {
        Optional<EntityEventReport> report = detector.detectEntityEvents("Oslo", day(40), day(50));

        assertThat(report).isEmpty();
    }

    @Test
    @DisplayName("Should throw for an unknown entity")
    void shouldThrowForUnknownEntity() {
        assertThatThrownBy(() -> detector.detectEntityEvents("Atlantis", null, null))
                .isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    @DisplayName("Should skip unknown entities when detecting for several")
    void shouldSkipUnknownEntities() {
        Map<String, EntityEventReport> reports = detector.detectEventsForMultipleEntities(
                List.of("Atlantis", "Oslo", "Bergen"), null, null, EntityEventDetector.DEFAULT_METHODS);

        assertThat(reports.keySet()).containsExactly("Oslo", "Bergen");
        assertThat(reports.get("Bergen").getEvents()).isEmpty();
    }

    @Test
    @DisplayName("Should give the same reports on a worker pool")
    void shouldDetectOnExecutor() {
        try (AnalysisExecutor executor = new AnalysisExecutor(2, Duration.ofSeconds(30))) {
            EntityEventDetector parallel = new EntityEventDetector(provider, anomalySettings,
                    new BurstDetector(2.0, 3, 1, 1), 3, executor);

            Map<String, EntityEventReport> reports = parallel.detectEventsForMultipleEntities(
                    List.of("Oslo", "Atlantis", "Bergen"), null, null, EntityEventDetector.DEFAULT_METHODS);

            assertThat(reports.keySet()).containsExactly("Oslo", "Bergen");
            assertThat(reports.get("Oslo").getEvents()).hasSize(1);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static LocalDate day(int offset) {
        return START.plusDays(offset);
    }
}
