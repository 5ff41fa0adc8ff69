package com.trendscope.core.series;

import com.trendscope.core.model.MentionRecord;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds mention records for tests.
 */
public final class MentionFixtures {

    private static int nextId;

    private MentionFixtures() {
    }

    /**
     * One record per mention, {@code counts[i]} of them on {@code start + i}.
     */
    public static List<MentionRecord> daily(String entity, LocalDate start, long... counts) {
        List<MentionRecord> records = new ArrayList<>();
        for (int day = 0; day < counts.length; day++) {
            for (long k = 0; k < counts[day]; k++) {
                records.add(mention("a" + (nextId++), entity, start.plusDays(day), 0.9));
            }
        }
        return records;
    }

    public static MentionRecord mention(String articleId, String entity, LocalDate day, double trustScore) {
        return MentionRecord.builder()
                .articleId(articleId)
                .entity(entity)
                .seenDate(day.atTime(12, 0))
                .title("Article " + articleId)
                .url("https://news.example/" + articleId)
                .domain("news.example")
                .theme("POLITICS")
                .trustScore(trustScore)
                .build();
    }

    public static InMemoryMentionRepository repository(List<List<MentionRecord>> groups) {
        List<MentionRecord> all = new ArrayList<>();
        groups.forEach(all::addAll);
        return new InMemoryMentionRepository(all);
    }
}
