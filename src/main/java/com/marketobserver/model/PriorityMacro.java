package com.marketobserver.model;

import com.marketobserver.core.Decimals;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Items per priority topic. Presence matters more than volume: one Fed headline is enough
 * to make the day a priority day.
 */
public final class PriorityMacro {
    public static final int SAMPLE_SIZE = 5;

    private final Map<PriorityTopic, List<ScoredItem>> items;

    public PriorityMacro(Map<PriorityTopic, List<ScoredItem>> items) {
        Map<PriorityTopic, List<ScoredItem>> copy = new EnumMap<>(PriorityTopic.class);
        for (PriorityTopic topic : PriorityTopic.values()) {
            List<ScoredItem> values = items == null ? null : items.get(topic);
            copy.put(topic, values == null ? List.of() : List.copyOf(values));
        }
        this.items = Collections.unmodifiableMap(copy);
    }

    public static PriorityMacro empty() {
        return new PriorityMacro(Map.of());
    }

    public List<ScoredItem> items(PriorityTopic topic) {
        return items.get(topic);
    }

    public int count(PriorityTopic topic) {
        return items(topic).size();
    }

    public boolean has(PriorityTopic topic) {
        return !items(topic).isEmpty();
    }

    /**
     * True when any topic other than the dollar index has at least one item.
     */
    public boolean hasAny() {
        for (PriorityTopic topic : PriorityTopic.values()) {
            if (topic.priority() && has(topic)) {
                return true;
            }
        }
        return false;
    }

    public int totalCount() {
        int total = 0;
        for (List<ScoredItem> values : items.values()) {
            total += values.size();
        }
        return total;
    }

    public List<ScoredItem> sample(PriorityTopic topic) {
        List<ScoredItem> values = items(topic);
        return values.subList(0, Math.min(SAMPLE_SIZE, values.size()));
    }

    /**
     * Mean impact score over {@link #sample}; 0 when the topic is empty.
     */
    public double averageScore(PriorityTopic topic) {
        List<ScoredItem> values = sample(topic);
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (ScoredItem item : values) {
            sum += item.impactScore;
        }
        return sum / values.size();
    }

    public String summary(PriorityTopic topic) {
        if (!has(topic)) {
            return "";
        }
        double avg = averageScore(topic);
        String shown = String.format(Locale.ROOT, "%+.1f", Decimals.round1(avg));
        String tone;
        if (avg >= 3) {
            tone = "強い買い材料が目立つ";
        } else if (avg >= 1) {
            tone = "やや買い寄りの内容";
        } else if (avg >= -1) {
            tone = "中立的な内容が中心";
        } else if (avg >= -3) {
            tone = "やや売り寄りの内容";
        } else {
            tone = "強い売り材料が目立つ";
        }
        return topic.label() + ": " + tone + "（平均スコア " + shown + "）";
    }
}
