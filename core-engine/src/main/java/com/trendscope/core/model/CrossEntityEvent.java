package com.trendscope.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A spike of articles that mention several tracked entities together.
 *
 * <p>
 * Built around a peak day of multi-entity articles and spanning a fixed
 * number of days either side of it. Count maps are ordered by count,
 * highest first.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}; the date range and peak date are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class CrossEntityEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int id;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final LocalDate peakDate;
    private final long articleCount;
    private final long peakCount;
    private final SortedSet<String> entities;
    private final Map<String, Long> entityCounts;
    private final Map<String, Long> pairCounts;
    private final Map<String, Long> topThemes;
    private final Map<String, Long> topSources;
    private final List<ArticleSummary> topArticles;

    private CrossEntityEvent(Builder b) {
        this.id = b.id;
        this.startDate = Objects.requireNonNull(b.startDate, "startDate must not be null");
        this.endDate = Objects.requireNonNull(b.endDate, "endDate must not be null");
        this.peakDate = Objects.requireNonNull(b.peakDate, "peakDate must not be null");
        this.articleCount = b.articleCount;
        this.peakCount = b.peakCount;
        this.entities = Collections.unmodifiableSortedSet(new TreeSet<>(b.entityCounts.keySet()));
        this.entityCounts = Collections.unmodifiableMap(new LinkedHashMap<>(b.entityCounts));
        this.pairCounts = Collections.unmodifiableMap(new LinkedHashMap<>(b.pairCounts));
        this.topThemes = Collections.unmodifiableMap(new LinkedHashMap<>(b.topThemes));
        this.topSources = Collections.unmodifiableMap(new LinkedHashMap<>(b.topSources));
        this.topArticles = List.copyOf(b.topArticles);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int id;
        private LocalDate startDate;
        private LocalDate endDate;
        private LocalDate peakDate;
        private long articleCount;
        private long peakCount;
        private Map<String, Long> entityCounts = new LinkedHashMap<>();
        private Map<String, Long> pairCounts = new LinkedHashMap<>();
        private Map<String, Long> topThemes = new LinkedHashMap<>();
        private Map<String, Long> topSources = new LinkedHashMap<>();
        private List<ArticleSummary> topArticles = new ArrayList<>();

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(LocalDate endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder peakDate(LocalDate peakDate) {
            this.peakDate = peakDate;
            return this;
        }

        public Builder articleCount(long articleCount) {
            this.articleCount = articleCount;
            return this;
        }

        public Builder peakCount(long peakCount) {
            this.peakCount = peakCount;
            return this;
        }

        public Builder entityCounts(Map<String, Long> entityCounts) {
            this.entityCounts = entityCounts;
            return this;
        }

        public Builder pairCounts(Map<String, Long> pairCounts) {
            this.pairCounts = pairCounts;
            return this;
        }

        public Builder topThemes(Map<String, Long> topThemes) {
            this.topThemes = topThemes;
            return this;
        }

        public Builder topSources(Map<String, Long> topSources) {
            this.topSources = topSources;
            return this;
        }

        public Builder topArticles(List<ArticleSummary> topArticles) {
            this.topArticles = topArticles;
            return this;
        }

        public CrossEntityEvent build() {
            return new CrossEntityEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getId() {
        return id;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public LocalDate getPeakDate() {
        return peakDate;
    }

    public long getArticleCount() {
        return articleCount;
    }

    public long getPeakCount() {
        return peakCount;
    }

    public SortedSet<String> getEntities() {
        return entities;
    }

    public Map<String, Long> getEntityCounts() {
        return entityCounts;
    }

    /**
     * @return co-mention counts keyed by {@code "a-b"} with {@code a < b}
     */
    public Map<String, Long> getPairCounts() {
        return pairCounts;
    }

    public Map<String, Long> getTopThemes() {
        return topThemes;
    }

    public Map<String, Long> getTopSources() {
        return topSources;
    }

    public List<ArticleSummary> getTopArticles() {
        return topArticles;
    }

    @Override
    public String toString() {
        return "CrossEntityEvent{" +
                "id=" + id +
                ", start=" + startDate +
                ", end=" + endDate +
                ", peak=" + peakDate +
                ", articles=" + articleCount +
                ", entities=" + entities +
                '}';
    }
}
