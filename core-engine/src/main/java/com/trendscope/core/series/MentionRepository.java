package com.trendscope.core.series;

import com.trendscope.core.model.MentionRecord;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Read interface of the persistence collaborator.
 *
 * <p>
 * Date bounds are inclusive calendar days; a {@code null} bound means
 * unbounded on that side. Implementations must be safe for concurrent reads.
 * </p>
 *
 * @since 1.0.0
 */
public interface MentionRepository {

    /**
     * @return {@code true} when at least one mention of {@code entity} is stored
     */
    boolean entityExists(String entity);

    /**
     * Mentions of one entity, ordered by seen date.
     */
    List<MentionRecord> findMentions(String entity, LocalDate start, LocalDate end);

    /**
     * Mentions of any of the given entities, one row per article-entity pair,
     * ordered by seen date.
     */
    List<MentionRecord> findMentionsForAny(Collection<String> entities, LocalDate start, LocalDate end);

    /**
     * Known entities ordered by total mention count, highest first.
     */
    List<String> listEntities();
}
