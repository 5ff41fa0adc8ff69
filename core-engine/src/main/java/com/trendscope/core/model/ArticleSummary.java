package com.trendscope.core.model;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Representative article of a cross-entity event.
 *
 * @since 1.0.0
 */
public final class ArticleSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String articleId;
    private final String title;
    private final String url;
    private final String domain;
    private final LocalDateTime seenDate;
    private final double trustScore;

    public ArticleSummary(MentionRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        this.articleId = record.getArticleId();
        this.title = record.getTitle();
        this.url = record.getUrl();
        this.domain = record.getDomain();
        this.seenDate = record.getSeenDate();
        this.trustScore = record.getTrustScore();
    }

    public String getArticleId() {
        return articleId;
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

    public LocalDateTime getSeenDate() {
        return seenDate;
    }

    public double getTrustScore() {
        return trustScore;
    }

    @Override
    public String toString() {
        return "ArticleSummary{articleId='" + articleId + "', title='" + title + "', trustScore=" + trustScore + '}';
    }
}
