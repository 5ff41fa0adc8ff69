package com.trendscope.core.detection;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.model.AnomalyRecord;
import com.trendscope.core.model.BurstEvent;
import com.trendscope.core.model.CoOccurringBurst;
import com.trendscope.core.model.EntityTimeSeries;
import com.trendscope.core.model.MultiScaleBurst;
import com.trendscope.core.model.Peak;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link BurstDetector}.
 */
class BurstDetectorTest {

    private static final LocalDate START = LocalDate.of(2024, 5, 6);

    private BurstDetector detector;
    private EntityTimeSeries spike;

    @BeforeEach
    void setUp() {
        detector = new BurstDetector(2.0, 3, 1, 1);
        spike = EntityTimeSeries.ofCounts("Lisbon", START, 2, 2, 2, 2, 20, 2, 2);
    }

    @Test
    @DisplayName("Should turn a single spike into one burst event")
    void shouldDetectSingleSpike() {
        List<BurstEvent> events = detector.detectBurstEvents(spike);

        assertThat(events).hasSize(1);
        BurstEvent event = events.get(0);
        assertThat(event.getPeakDate()).isEqualTo(START.plusDays(4));
        assertThat(event.getPeakValue()).isEqualTo(20.0);
        assertThat(event.getDurationDays()).isEqualTo(1);
        assertThat(event.getDates()).containsExactly(START.plusDays(4));
    }

    @Test
    @DisplayName("Should not score days until the window has filled")
    void shouldLeaveLeadingDaysUnscored() {
        List<AnomalyRecord> records = detector.detectBursts(spike);

        assertThat(records).hasSize(7);
        assertThat(records.subList(0, 3)).extracting(AnomalyRecord::getScore).containsOnly(0.0);
        assertThat(records.get(3).isAnomaly()).isFalse();
        assertThat(records.get(5).isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Should never flag a drop below the baseline")
    void shouldIgnoreDecreases() {
        EntityTimeSeries drop = EntityTimeSeries.ofCounts("Lisbon", START, 10, 10, 10, 10, 1);

        List<AnomalyRecord> records = detector.detectBursts(drop);

        assertThat(records).noneMatch(AnomalyRecord::isAnomaly);
        assertThat(records.get(4).getScore()).isNegative();
    }

    @Test
    @DisplayName("Should cap the score of a rise from a flat baseline")
    void shouldCapScoreOnFlatBaseline() {
        EntityTimeSeries sparse = EntityTimeSeries.ofCounts("Lisbon", START, 0, 0, 0, 1, 0, 0, 0, 0);

        List<AnomalyRecord> records = detector.detectBursts(sparse);

        assertThat(records.get(3).isAnomaly()).isTrue();
        assertThat(records.get(3).getScore()).isEqualTo(BurstDetector.MAX_SCORE);
        assertThat(records.get(4).getScore()).isCloseTo(-1.0 / Math.sqrt(2.0), within(1e-6));
        assertThat(records).extracting(AnomalyRecord::getScore)
                .allSatisfy(score -> assertThat(Math.abs(score)).isLessThanOrEqualTo(BurstDetector.MAX_SCORE));
    }

    @Test
    @DisplayName("Should not score a series no longer than the window")
    void shouldSkipShortSeries() {
        EntityTimeSeries shortSeries = EntityTimeSeries.ofCounts("Lisbon", START, 1, 1, 50);

        assertThat(detector.detectBursts(shortSeries)).noneMatch(AnomalyRecord::isAnomaly);
    }

    @Test
    @DisplayName("Should drop bursts shorter than the minimum duration")
    void shouldApplyMinimumDuration() {
        BurstDetector strict = new BurstDetector(2.0, 3, 2, 1);

        assertThat(strict.detectBurstEvents(spike)).isEmpty();
    }

    @Test
    @DisplayName("Should merge flagged days across gaps up to the maximum")
    void shouldMergeAcrossGaps() {
        EntityTimeSeries twoSpikes = EntityTimeSeries.ofCounts("Lisbon", START, 1, 1, 1, 1, 9, 1, 1, 1, 9);

        List<BurstEvent> merged = new BurstDetector(2.0, 3, 1, 4).detectBurstEvents(twoSpikes);
        List<BurstEvent> split = new BurstDetector(2.0, 3, 1, 3).detectBurstEvents(twoSpikes);

        assertThat(merged).hasSize(1);
        assertThat(merged.get(0).getDates()).containsExactly(START.plusDays(4), START.plusDays(8));
        assertThat(merged.get(0).getDurationDays()).isEqualTo(5);
        assertThat(merged.get(0).getPeakDate()).isEqualTo(START.plusDays(4));
        assertThat(split).hasSize(2);
    }

    @Test
    @DisplayName("Should find peaks with their prominence and width")
    void shouldDetectPeaks() {
        EntityTimeSeries series = EntityTimeSeries.ofCounts("Lisbon", START, 0, 1, 5, 1, 0, 3, 0);

        List<Peak> peaks = detector.detectPeaks(series, 1.0, 1.0);

        assertThat(peaks).hasSize(2);
        assertThat(peaks.get(0).getDate()).isEqualTo(START.plusDays(2));
        assertThat(peaks.get(0).getProminence()).isEqualTo(5.0);
        assertThat(peaks.get(0).getWidth()).isCloseTo(1.25, within(1e-9));
        assertThat(peaks.get(1).getDate()).isEqualTo(START.plusDays(5));
        assertThat(peaks.get(1).getProminence()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should filter peaks below the minimum prominence")
    void shouldFilterPeaksByProminence() {
        EntityTimeSeries series = EntityTimeSeries.ofCounts("Lisbon", START, 0, 1, 5, 1, 0, 3, 0);

        assertThat(detector.detectPeaks(series, 4.0, 0.0)).extracting(Peak::getValue).containsExactly(5.0);
    }

    @Test
    @DisplayName("Should score every day at each requested scale")
    void shouldDetectMultiScaleBursts() {
        List<MultiScaleBurst> bursts = detector.detectMultiScaleBursts(spike, List.of(3, 5));

        assertThat(bursts).hasSize(7);
        MultiScaleBurst day = bursts.get(4);
        assertThat(day.getScaleScores()).containsOnlyKeys(3, 5);
        assertThat(day.getScaleFlags()).containsEntry(3, true).containsEntry(5, false);
        assertThat(day.isBurst()).isTrue();
        assertThat(day.getCombinedScore()).isCloseTo(day.getScaleScores().get(3) / 2, within(1e-6));
    }

    @Test
    @DisplayName("Should reject an empty list of scales")
    void shouldRejectEmptyScales() {
        assertThatThrownBy(() -> detector.detectMultiScaleBursts(spike, List.of()))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    @DisplayName("Should report days on which two entities burst together")
    void shouldDetectCoOccurringBursts() {
        Map<String, EntityTimeSeries> series = new LinkedHashMap<>();
        series.put("Lisbon", spike);
        series.put("Madrid", EntityTimeSeries.ofCounts("Madrid", START, 3, 3, 3, 3, 30, 3, 3));
        series.put("Porto", EntityTimeSeries.ofCounts("Porto", START, 1, 1, 1, 1, 1, 1, 1));

        List<CoOccurringBurst> bursts = detector.detectEntityCorrelationBursts(series);

        assertThat(bursts).hasSize(1);
        assertThat(bursts.get(0).getId()).isEqualTo(1);
        assertThat(bursts.get(0).getEntities()).containsExactly("Lisbon", "Madrid");
        assertThat(bursts.get(0).getDates()).containsExactly(START.plusDays(4));
    }

    @Test
    @DisplayName("Should reject a non-positive sensitivity")
    void shouldRejectSensitivity() {
        assertThatThrownBy(() -> new BurstDetector(0.0, 3, 1, 1))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("sensitivity");
    }
}
