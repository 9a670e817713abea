package com.marketobserver.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single ingested text item. Fields other than text and origin travel in
 * {@link #metadata} untouched through every stage.
 */
public final class NewsItem {
    public final String text;
    public final Origin origin;
    public final Map<String, Object> metadata;

    public NewsItem(String text, Origin origin) {
        this(text, origin, Map.of());
    }

    public NewsItem(String text, Origin origin, Map<String, Object> metadata) {
        this.text = text == null ? "" : text;
        this.origin = origin == null ? Origin.DOMESTIC : origin;
        this.metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Object metadata(String key) {
        return metadata.get(key);
    }

    @Override
    public String toString() {
        return "NewsItem{origin=" + origin.wireName() + ", text=" + text + "}";
    }
}
