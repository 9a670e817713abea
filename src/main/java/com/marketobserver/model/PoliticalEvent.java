package com.marketobserver.model;

import java.util.List;

/**
 * A statement by a market-moving speaker in a market-sensitive context. Observed only;
 * it carries no score of its own and no direction.
 */
public record PoliticalEvent(
        ScoredItem item,
        String speaker,
        String context,
        String summary,
        List<String> detectedKeywords
) {
    public static final String UNKNOWN_SOURCE = "Unknown";

    public PoliticalEvent {
        if (item == null) {
            throw new IllegalArgumentException("item must not be null");
        }
        detectedKeywords = detectedKeywords == null ? List.of() : List.copyOf(detectedKeywords);
    }

    public String sourceName() {
        Object raw = item.metadata().get("source_name");
        return raw == null ? UNKNOWN_SOURCE : String.valueOf(raw);
    }

    public String url() {
        Object raw = item.metadata().get("url");
        return raw == null ? null : String.valueOf(raw);
    }
}
