package com.trendscope.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One occurrence of an entity in one article.
 *
 * <p>
 * This is the row shape the persistence collaborator hands to the analysis
 * core. Daily counts are derived from these rows by grouping on the calendar
 * day of {@link #getSeenDate()}. Article metadata (title, source domain,
 * theme, trust score) is only consulted by the cross-entity event analysis.
 * </p>
 *
 * <p>
 * Deserialized by Jackson from mention exports; unknown properties are
 * ignored.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MentionRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String articleId;
    private final String entity;
    private final LocalDateTime seenDate;
    private final String title;
    private final String url;
    private final String domain;
    private final String theme;
    private final double trustScore;

    @JsonCreator
    public MentionRecord(@JsonProperty("articleId") String articleId,
            @JsonProperty("entity") String entity,
            @JsonProperty("seenDate") LocalDateTime seenDate,
            @JsonProperty("title") String title,
            @JsonProperty("url") String url,
            @JsonProperty("domain") String domain,
            @JsonProperty("theme") String theme,
            @JsonProperty("trustScore") Double trustScore) {
        this.articleId = Objects.requireNonNull(articleId, "articleId must not be null");
        this.entity = Objects.requireNonNull(entity, "entity must not be null");
        this.seenDate = Objects.requireNonNull(seenDate, "seenDate must not be null");
        this.title = title;
        this.url = url;
        this.domain = domain;
        this.theme = theme;
        this.trustScore = trustScore != null ? trustScore : 0.0;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link MentionRecord}; {@code articleId},
     * {@code entity} and {@code seenDate} are required.
     */
    public static class Builder {
        private String articleId;
        private String entity;
        private LocalDateTime seenDate;
        private String title;
        private String url;
        private String domain;
        private String theme;
        private double trustScore;

        public Builder articleId(String articleId) {
            this.articleId = articleId;
            return this;
        }

        public Builder entity(String entity) {
            this.entity = entity;
            return this;
        }

        public Builder seenDate(LocalDateTime seenDate) {
            this.seenDate = seenDate;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder theme(String theme) {
            this.theme = theme;
            return this;
        }

        public Builder trustScore(double trustScore) {
            this.trustScore = trustScore;
            return this;
        }

        public MentionRecord build() {
            return new MentionRecord(articleId, entity, seenDate, title, url, domain, theme, trustScore);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getArticleId() {
        return articleId;
    }

    public String getEntity() {
        return entity;
    }

    public LocalDateTime getSeenDate() {
        return seenDate;
    }

    public String getTitle() {
        return title;
    }

    public String getUrl() {
        return url;
    }

    public String getDomain() {
        return domain;
    }

    public String getTheme() {
        return theme;
    }

    public double getTrustScore() {
        return trustScore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MentionRecord that))
            return false;
        return articleId.equals(that.articleId) && entity.equals(that.entity)
                && seenDate.equals(that.seenDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(articleId, entity, seenDate);
    }

    @Override
    public String toString() {
        return "MentionRecord{" +
                "articleId='" + articleId + '\'' +
                ", entity='" + entity + '\'' +
                ", seenDate=" + seenDate +
                ", domain='" + domain + '\'' +
                ", trustScore=" + trustScore +
                '}';
    }
}
