package com.trendscope.core.series;

import com.trendscope.core.EntityNotFoundException;
import com.trendscope.core.model.DailyCount;
import com.trendscope.core.model.EntityTimeSeries;
import com.trendscope.core.model.MentionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Builds contiguous daily count series from stored mentions.
 *
 * <p>
 * Mentions are grouped by the calendar day they were seen and reindexed over
 * the span from the first to the last observed day, so every day in between
 * carries an explicit, possibly zero, count. Reads have no side effects:
 * asking twice for the same entity and range yields equal series.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeSeriesProvider {

    private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesProvider.class);

    private final MentionRepository repository;

    public TimeSeriesProvider(MentionRepository repository) {
        this.repository = Objects.requireNonNull(repository, "MentionRepository must not be null");
    }

    /**
     * @see #getEntityTimeSeries(String, LocalDate, LocalDate)
     */
    public EntityTimeSeries getEntityTimeSeries(String entity) {
        return getEntityTimeSeries(entity, null, null);
    }

    /**
     * Daily mention counts of one entity.
     *
     * @param entity entity identifier; must not be {@code null}
     * @param start  first day to include, or {@code null} for no lower bound
     * @param end    last day to include, or {@code null} for no upper bound
     * @return contiguous series; empty when the entity has no mentions in range
     * @throws EntityNotFoundException if the entity has no stored mentions at all
     */
    public EntityTimeSeries getEntityTimeSeries(String entity, LocalDate start, LocalDate end) {
        Objects.requireNonNull(entity, "entity must not be null");
        if (start != null && end != null && start.isAfter(end)) {
            throw new IllegalArgumentException("start " + start + " is after end " + end);
        }
        if (!repository.entityExists(entity)) {
            throw new EntityNotFoundException(entity);
        }

        List<MentionRecord> mentions = repository.findMentions(entity, start, end);
        if (mentions.isEmpty()) {
            LOG.trace("Entity '{}' has no mentions between {} and {}", entity, start, end);
            return EntityTimeSeries.empty(entity);
        }

        TreeMap<LocalDate, Long> perDay = new TreeMap<>();
        for (MentionRecord mention : mentions) {
            perDay.merge(mention.getSeenDate().toLocalDate(), 1L, Long::sum);
        }
        return reindex(entity, perDay);
    }

    /**
     * Series for several entities.
     *
     * <p>
     * Entities that are unknown or have no mentions in range are skipped with
     * a warning rather than failing the whole request.
     * </p>
     *
     * @return series keyed by entity, in the order of {@code entities}
     */
    public Map<String, EntityTimeSeries> getMultipleEntityTimeSeries(List<String> entities, LocalDate start,
            LocalDate end) {
        Objects.requireNonNull(entities, "entities must not be null");
        Map<String, EntityTimeSeries> result = new LinkedHashMap<>();
        for (String entity : entities) {
            try {
                EntityTimeSeries series = getEntityTimeSeries(entity, start, end);
                if (series.isEmpty()) {
                    LOG.warn("No data for entity '{}' in range {}..{}; skipping", entity, start, end);
                } else {
                    result.put(entity, series);
                }
            } catch (EntityNotFoundException e) {
                LOG.warn("Entity '{}' not found; skipping", entity);
            }
        }
        return result;
    }

    private static EntityTimeSeries reindex(String entity, TreeMap<LocalDate, Long> perDay) {
        LocalDate first = perDay.firstKey();
        LocalDate last = perDay.lastKey();
        List<DailyCount> points = new ArrayList<>();
        for (LocalDate day = first; !day.isAfter(last); day = day.plusDays(1)) {
            points.add(new DailyCount(day, perDay.getOrDefault(day, 0L)));
        }
        return new EntityTimeSeries(entity, points);
    }
}
