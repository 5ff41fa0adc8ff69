package com.trendscope.core.series;

import com.trendscope.core.model.MentionRecord;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link MentionRepository} over an immutable list of records held in memory.
 *
 * <p>
 * Used by the batch job, which loads a mentions export up front, and by
 * tests.
 * </p>
 *
 * @since 1.0.0
 */
public final class InMemoryMentionRepository implements MentionRepository {

    private static final Comparator<MentionRecord> BY_SEEN_DATE = Comparator.comparing(MentionRecord::getSeenDate);

    private final List<MentionRecord> records;
    private final Map<String, Long> mentionCounts = new HashMap<>();

    public InMemoryMentionRepository(Collection<MentionRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        this.records = records.stream().sorted(BY_SEEN_DATE).toList();
        for (MentionRecord record : this.records) {
            mentionCounts.merge(record.getEntity(), 1L, Long::sum);
        }
    }

    @Override
    public boolean entityExists(String entity) {
        return mentionCounts.containsKey(entity);
    }

    @Override
    public List<MentionRecord> findMentions(String entity, LocalDate start, LocalDate end) {
        Objects.requireNonNull(entity, "entity must not be null");
        return records.stream()
                .filter(r -> r.getEntity().equals(entity))
                .filter(r -> inRange(r, start, end))
                .toList();
    }

    @Override
    public List<MentionRecord> findMentionsForAny(Collection<String> entities, LocalDate start, LocalDate end) {
        Objects.requireNonNull(entities, "entities must not be null");
        Set<String> wanted = new HashSet<>(entities);
        return records.stream()
                .filter(r -> wanted.contains(r.getEntity()))
                .filter(r -> inRange(r, start, end))
                .toList();
    }

    @Override
    public List<String> listEntities() {
        return mentionCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, Long>comparingByKey()))
                .map(Map.Entry::getKey)
                .toList();
    }

    public int size() {
        return records.size();
    }

    private static boolean inRange(MentionRecord record, LocalDate start, LocalDate end) {
        LocalDate day = record.getSeenDate().toLocalDate();
        return (start == null || !day.isBefore(start)) && (end == null || !day.isAfter(end));
    }
}
