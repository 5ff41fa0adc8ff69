package com.trendscope.core.event;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.model.ArticleSummary;
import com.trendscope.core.model.CrossEntityEvent;
import com.trendscope.core.model.MentionRecord;
import com.trendscope.core.series.MentionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Article-level analysis of entities that appear in the same articles.
 *
 * <p>
 * Works directly on mention records rather than on daily series: an
 * article counts once however many of the tracked entities it mentions.
 * Articles below the minimum trust score are ignored.
 * </p>
 *
 * <h3>Events</h3>
 * <p>
 * Articles mentioning at least two tracked entities are counted per day. A
 * day is a peak when its count is strictly above both neighbouring observed
 * days and at least {@code minArticles}. Each peak becomes a
 * {@link CrossEntityEvent} over the articles within {@code clusterThreshold}
 * days of it.
 * </p>
 *
 * @since 1.0.0
 */
public class CrossEntityEventDetector {

    private static final Logger LOG = LoggerFactory.getLogger(CrossEntityEventDetector.class);

    static final int TOP_PAIRS = 5;
    static final int TOP_THEMES = 3;
    static final int TOP_SOURCES = 5;
    static final int TOP_ARTICLES = 5;

    private final MentionRepository repository;

    public CrossEntityEventDetector(MentionRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
    }

    /**
     * Number of distinct trusted articles mentioning each ordered pair of
     * entities.
     *
     * @return counts keyed by first entity then second entity, in input
     *         order; pairs that never co-occur and unknown entities are left
     *         out
     */
    public Map<String, Map<String, Long>> findEntityCoOccurrences(List<String> entities, LocalDate start,
            LocalDate end, double minTrustScore) {
        List<String> known = knownEntities(entities);
        Map<String, Map<String, Long>> result = new LinkedHashMap<>();
        if (known.isEmpty()) {
            return result;
        }

        Map<String, Set<String>> articleEntities = new HashMap<>();
        for (Article article : articles(known, start, end, minTrustScore).values()) {
            articleEntities.put(article.record.getArticleId(), article.entities);
        }

        for (String first : known) {
            Map<String, Long> row = new LinkedHashMap<>();
            for (String second : known) {
                if (first.equals(second)) {
                    continue;
                }
                long count = articleEntities.values().stream()
                        .filter(mentioned -> mentioned.contains(first) && mentioned.contains(second))
                        .count();
                if (count > 0) {
                    row.put(second, count);
                }
            }
            result.put(first, row);
        }
        return result;
    }

    /**
     * Peaks of multi-entity coverage and the articles around them.
     *
     * @param clusterThreshold days on each side of a peak the event spans
     * @param minArticles      fewest articles on a peak day
     * @return events sorted by peak date, numbered from 1
     */
    public List<CrossEntityEvent> identifyCrossEntityEvents(List<String> entities, int clusterThreshold,
            int minArticles, LocalDate start, LocalDate end, double minTrustScore) {
        InvalidParameterException.requireAtLeast("clusterThreshold", clusterThreshold, 0);
        InvalidParameterException.requireAtLeast("minArticles", minArticles, 1);
        LOG.info("Identifying cross-entity events for {}", entities);

        List<String> known = knownEntities(entities);
        if (known.isEmpty()) {
            return List.of();
        }
        List<Article> shared = articles(known, start, end, minTrustScore).values().stream()
                .filter(article -> article.entities.size() >= 2)
                .toList();
        if (shared.isEmpty()) {
            LOG.warn("No articles mention at least 2 of {}", known);
            return List.of();
        }

        TreeMap<LocalDate, Long> perDay = new TreeMap<>();
        for (Article article : shared) {
            perDay.merge(article.day(), 1L, Long::sum);
        }
        List<LocalDate> days = new ArrayList<>(perDay.keySet());

        List<CrossEntityEvent> events = new ArrayList<>();
        for (int i = 0; i < days.size(); i++) {
            long count = perDay.get(days.get(i));
            boolean peak = count >= minArticles
                    && (i == 0 || count > perDay.get(days.get(i - 1)))
                    && (i == days.size() - 1 || count > perDay.get(days.get(i + 1)));
            if (!peak) {
                continue;
            }
            LocalDate peakDate = days.get(i);
            LocalDate from = peakDate.minusDays(clusterThreshold);
            LocalDate to = peakDate.plusDays(clusterThreshold);
            List<Article> cluster = shared.stream()
                    .filter(a -> !a.day().isBefore(from) && !a.day().isAfter(to))
                    .toList();
            if (cluster.size() < minArticles) {
                continue;
            }
            events.add(buildEvent(events.size() + 1, from, to, peakDate, count, cluster));
        }

        LOG.info("Identified {} cross-entity event(s)", events.size());
        return events;
    }

    private static CrossEntityEvent buildEvent(int id, LocalDate from, LocalDate to, LocalDate peakDate,
            long peakCount, List<Article> cluster) {
        Map<String, Long> entityCounts = new HashMap<>();
        Map<String, Long> pairCounts = new HashMap<>();
        for (Article article : cluster) {
            List<String> mentioned = new ArrayList<>(new TreeSet<>(article.entities));
            for (int a = 0; a < mentioned.size(); a++) {
                entityCounts.merge(mentioned.get(a), 1L, Long::sum);
                for (int b = a + 1; b < mentioned.size(); b++) {
                    pairCounts.merge(mentioned.get(a) + "-" + mentioned.get(b), 1L, Long::sum);
                }
            }
        }

        List<ArticleSummary> topArticles = cluster.stream()
                .sorted(Comparator.comparingDouble((Article a) -> a.record.getTrustScore()).reversed())
                .limit(TOP_ARTICLES)
                .map(a -> new ArticleSummary(a.record))
                .toList();

        return CrossEntityEvent.builder()
                .id(id)
                .startDate(from)
                .endDate(to)
                .peakDate(peakDate)
                .articleCount(cluster.size())
                .peakCount(peakCount)
                .entityCounts(top(entityCounts, Integer.MAX_VALUE))
                .pairCounts(top(pairCounts, TOP_PAIRS))
                .topThemes(top(countBy(cluster, a -> a.record.getTheme()), TOP_THEMES))
                .topSources(top(countBy(cluster, a -> a.record.getDomain()), TOP_SOURCES))
                .topArticles(topArticles)
                .build();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<String> knownEntities(List<String> entities) {
        Objects.requireNonNull(entities, "entities must not be null");
        List<String> known = new ArrayList<>();
        for (String entity : new LinkedHashSet<>(entities)) {
            if (repository.entityExists(entity)) {
                known.add(entity);
            } else {
                LOG.warn("Entity '{}' not found; skipping", entity);
            }
        }
        if (known.isEmpty()) {
            LOG.warn("No valid entities among {}", entities);
        }
        return known;
    }

    /** Trusted articles keyed by id, in order of first appearance. */
    private Map<String, Article> articles(List<String> entities, LocalDate start, LocalDate end,
            double minTrustScore) {
        Map<String, Article> articles = new LinkedHashMap<>();
        for (MentionRecord record : repository.findMentionsForAny(entities, start, end)) {
            if (record.getTrustScore() < minTrustScore) {
                continue;
            }
            articles.computeIfAbsent(record.getArticleId(), id -> new Article(record))
                    .entities.add(record.getEntity());
        }
        return articles;
    }

    private static Map<String, Long> countBy(List<Article> cluster, Function<Article, String> key) {
        Map<String, Long> counts = new HashMap<>();
        for (Article article : cluster) {
            String value = key.apply(article);
            if (value != null && !value.isBlank()) {
                counts.merge(value, 1L, Long::sum);
            }
        }
        return counts;
    }

    /** The {@code limit} largest counts, highest first, ties by key. */
    private static Map<String, Long> top(Map<String, Long> counts, int limit) {
        Map<String, Long> result = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, Long>comparingByKey()))
                .limit(limit)
                .forEach(e -> result.put(e.getKey(), e.getValue()));
        return result;
    }

    /** One article with the tracked entities it mentions. */
    private static final class Article {
        private final MentionRecord record;
        private final Set<String> entities = new LinkedHashSet<>();

        Article(MentionRecord record) {
            this.record = record;
        }

        LocalDate day() {
            return record.getSeenDate().toLocalDate();
        }
    }
}
