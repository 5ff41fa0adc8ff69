package com.trendscope.core.series;

import com.trendscope.core.EntityNotFoundException;
import com.trendscope.core.model.EntityTimeSeries;
import com.trendscope.core.model.MentionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TimeSeriesProvider}.
 */
class TimeSeriesProviderTest {

    private static final LocalDate START = LocalDate.of(2024, 3, 1);

    private TimeSeriesProvider provider;

    @BeforeEach
    void setUp() {
        List<MentionRecord> records = new ArrayList<>();
        records.addAll(MentionFixtures.daily("Berlin", START, 2, 0, 0, 3, 1));
        records.addAll(MentionFixtures.daily("Paris", START.plusDays(2), 4));
        provider = new TimeSeriesProvider(new InMemoryMentionRepository(records));
    }

    @Test
    @DisplayName("Should fill days without mentions with zero")
    void shouldReindexWithZeros() {
        EntityTimeSeries series = provider.getEntityTimeSeries("Berlin");

        assertThat(series.getStartDate()).isEqualTo(START);
        assertThat(series.getEndDate()).isEqualTo(START.plusDays(4));
        assertThat(series.values()).containsExactly(2.0, 0.0, 0.0, 3.0, 1.0);
        assertThat(series.total()).isEqualTo(6);
    }

    @Test
    @DisplayName("Should span only observed days inside the requested range")
    void shouldTrimToObservedRange() {
        EntityTimeSeries series = provider.getEntityTimeSeries("Berlin", START.plusDays(1), START.plusDays(4));

        assertThat(series.getStartDate()).isEqualTo(START.plusDays(3));
        assertThat(series.values()).containsExactly(3.0, 1.0);
    }

    @Test
    @DisplayName("Should return an empty series when no mention falls in range")
    void shouldReturnEmptySeriesOutsideRange() {
        EntityTimeSeries series = provider.getEntityTimeSeries("Paris", START, START.plusDays(1));

        assertThat(series.isEmpty()).isTrue();
        assertThat(series.getStartDate()).isNull();
    }

    @Test
    @DisplayName("Should return equal series for repeated reads")
    void shouldBeIdempotent() {
        assertThat(provider.getEntityTimeSeries("Berlin")).isEqualTo(provider.getEntityTimeSeries("Berlin"));
    }

    @Test
    @DisplayName("Should throw for an unknown entity")
    void shouldThrowForUnknownEntity() {
        assertThatThrownBy(() -> provider.getEntityTimeSeries("Atlantis"))
                .isInstanceOf(EntityNotFoundException.class)
                .hasMessageContaining("Atlantis");
    }

    @Test
    @DisplayName("Should reject a start date after the end date")
    void shouldRejectInvertedRange() {
        assertThatThrownBy(() -> provider.getEntityTimeSeries("Berlin", START.plusDays(2), START))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should skip unknown and empty entities when loading several")
    void shouldSkipUnusableEntities() {
        Map<String, EntityTimeSeries> series = provider.getMultipleEntityTimeSeries(
                List.of("Paris", "Atlantis", "Berlin"), START.plusDays(3), null);

        assertThat(series).containsOnlyKeys("Berlin");
    }

    @Test
    @DisplayName("Should keep the requested entity order")
    void shouldKeepRequestOrder() {
        Map<String, EntityTimeSeries> series = provider.getMultipleEntityTimeSeries(
                List.of("Paris", "Berlin"), null, null);

        assertThat(series.keySet()).containsExactly("Paris", "Berlin");
    }

    @Test
    @DisplayName("Should list entities by mention count, most mentioned first")
    void shouldListEntitiesByCount() {
        List<MentionRecord> records = new ArrayList<>();
        records.addAll(MentionFixtures.daily("Berlin", START, 2, 0, 0, 3, 1));
        records.addAll(MentionFixtures.daily("Paris", START.plusDays(2), 4));
        records.addAll(MentionFixtures.daily("Oslo", START, 4));

        InMemoryMentionRepository repository = new InMemoryMentionRepository(records);

        assertThat(repository.listEntities()).containsExactly("Berlin", "Oslo", "Paris");
        assertThat(repository.size()).isEqualTo(14);
    }
}
