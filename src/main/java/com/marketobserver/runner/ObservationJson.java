package com.marketobserver.runner;

import com.marketobserver.core.Decimals;
import com.marketobserver.model.AggregateRecord;
import com.marketobserver.model.Alert;
import com.marketobserver.model.HistoryComparison;
import com.marketobserver.model.MacroObservation;
import com.marketobserver.model.PoliticalEvent;
import com.marketobserver.model.PriorityMacro;
import com.marketobserver.model.PriorityTopic;
import com.marketobserver.model.ScoredItem;
import com.marketobserver.model.Trigger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders an {@link ObservationResult} as the JSON document consumed by reporting and UI.
 */
public final class ObservationJson {

    public JSONObject toJson(ObservationResult result) {
        JSONObject root = new JSONObject();
        root.put("date", result.date == null ? JSONObject.NULL : result.date.toString());
        root.put("summary", result.summary);
        root.put("submitted_count", result.submittedCount);
        root.put("scored_count", result.scoredCount);
        root.put("skipped_count", result.skippedCount());
        root.put("aggregate", aggregate(result.aggregate));

        JSONObject ratios = new JSONObject();
        ratios.put("zero_ratio", result.ratios.zeroRatio());
        ratios.put("plus2_ratio", result.ratios.plus2Ratio());
        ratios.put("minus2_ratio", result.ratios.minus2Ratio());
        ratios.put("macro_ratio", result.ratios.macroRatio());
        root.put("ratios", ratios);

        root.put("macro", macro(result.macro));
        root.put("has_priority", result.priorityMacro.hasAny());
        root.put("priority_macro", priorityMacro(result.priorityMacro));
        root.put("political_events", politicalEvents(result.politicalEvents));
        root.put("consecutive_high_zero_days", result.consecutiveHighZeroDays);

        JSONArray alerts = new JSONArray();
        for (Alert a : result.alerts) {
            JSONObject o = new JSONObject();
            o.put("type", a.type().wireName());
            o.put("severity", a.severity().wireName());
            o.put("message", a.message());
            alerts.put(o);
        }
        root.put("alerts", alerts);

        JSONArray triggers = new JSONArray();
        for (Trigger tr : result.triggers) {
            JSONObject o = new JSONObject();
            o.put("id", tr.id());
            o.put("name", tr.name());
            o.put("message", tr.message());
            o.put("fired", tr.fired());
            triggers.put(o);
        }
        root.put("triggers", triggers);

        root.put("history", history(result.history));

        JSONArray items = new JSONArray();
        for (ScoredItem item : result.scoredItems) {
            items.put(item(item));
        }
        root.put("items", items);
        return root;
    }

    JSONObject item(ScoredItem item) {
        JSONObject o = new JSONObject();
        for (Map.Entry<String, Object> e : item.metadata().entrySet()) {
            o.put(e.getKey(), e.getValue() == null ? JSONObject.NULL : e.getValue());
        }
        o.put("text", item.text());
        o.put("origin", item.origin().wireName());
        o.put("category", item.category().wireName());
        o.put("category_name", item.category().displayName());
        o.put("sub_category", item.subCategory() == null ? JSONObject.NULL : item.subCategory());
        o.put("impact_score", item.impactScore);
        o.put("score_reason", item.reason);
        return o;
    }

    private JSONObject aggregate(AggregateRecord a) {
        JSONObject o = new JSONObject();
        o.put("total_score", a.totalScore);
        o.put("domestic_score", a.domesticScore);
        o.put("foreign_score", a.foreignScore);
        o.put("domestic_foreign_gap", a.domesticForeignGap);
        o.put("news_count", a.newsCount);
        o.put("zero_score_count", a.zeroScoreCount);
        return o;
    }

    private JSONObject macro(MacroObservation m) {
        JSONObject o = new JSONObject();
        o.put("fx_count", m.fxCount());
        o.put("rates_count", m.ratesCount());
        o.put("data_count", m.dataCount());
        o.put("fx_keywords", new JSONArray(m.fxKeywords));
        o.put("rates_keywords", new JSONArray(m.ratesKeywords));
        o.put("data_keywords", new JSONArray(m.dataKeywords));
        return o;
    }

    JSONObject priorityMacro(PriorityMacro p) {
        JSONObject o = new JSONObject();
        for (PriorityTopic topic : PriorityTopic.values()) {
            JSONObject t = new JSONObject();
            t.put("count", p.count(topic));
            t.put("has", p.has(topic));
            t.put("avg_score", Decimals.round1(p.averageScore(topic)));
            t.put("summary", p.summary(topic));
            JSONArray articles = new JSONArray();
            for (ScoredItem item : p.sample(topic)) {
                JSONObject a = new JSONObject();
                a.put("title", titleOf(item));
                a.put("url", metadataOr(item, "url", JSONObject.NULL));
                a.put("source_name", metadataOr(item, "source_name", ""));
                a.put("score", item.impactScore);
                a.put("reason", item.reason);
                articles.put(a);
            }
            t.put("articles", articles);
            o.put(topic.wireName(), t);
        }
        return o;
    }

    /**
     * One entry per speaker, in first-seen order. Items repeating a summary already shown
     * for that speaker are dropped; {@code count} is the number of distinct summaries.
     */
    JSONArray politicalEvents(List<PoliticalEvent> events) {
        Map<String, List<PoliticalEvent>> bySpeaker = new LinkedHashMap<>();
        for (PoliticalEvent e : events) {
            bySpeaker.computeIfAbsent(e.speaker(), k -> new ArrayList<>()).add(e);
        }
        JSONArray out = new JSONArray();
        for (Map.Entry<String, List<PoliticalEvent>> group : bySpeaker.entrySet()) {
            Map<String, Integer> themes = new LinkedHashMap<>();
            Set<String> summaries = new LinkedHashSet<>();
            Set<String> sources = new LinkedHashSet<>();
            JSONArray articles = new JSONArray();
            for (PoliticalEvent e : group.getValue()) {
                themes.merge(e.context(), 1, Integer::sum);
                sources.add(e.sourceName());
                if (!summaries.add(e.summary()) || articles.length() >= PriorityMacro.SAMPLE_SIZE) {
                    continue;
                }
                JSONObject i = new JSONObject();
                i.put("summary", e.summary());
                i.put("title", titleOf(e.item()));
                i.put("description", head(e.item().text(), 200));
                i.put("url", e.url() == null ? JSONObject.NULL : e.url());
                i.put("source_name", e.sourceName());
                i.put("detected_keywords", new JSONArray(e.detectedKeywords()));
                i.put("score", e.item().impactScore);
                i.put("reason", e.item().reason);
                articles.put(i);
            }
            JSONArray themeArray = new JSONArray();
            for (Map.Entry<String, Integer> theme : themes.entrySet()) {
                themeArray.put(new JSONObject().put("name", theme.getKey()).put("count", theme.getValue()));
            }
            JSONObject o = new JSONObject();
            o.put("speaker", group.getKey());
            o.put("themes", themeArray);
            o.put("articles", articles);
            o.put("count", summaries.size());
            o.put("sources", new JSONArray(new ArrayList<>(sources).subList(0, Math.min(3, sources.size()))));
            out.put(o);
        }
        return out;
    }

    private static String titleOf(ScoredItem item) {
        Object title = item.metadata().get("title");
        return title == null ? head(item.text(), 60) : String.valueOf(title);
    }

    private static Object metadataOr(ScoredItem item, String key, Object fallback) {
        Object value = item.metadata().get(key);
        return value == null ? fallback : value;
    }

    private static String head(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }

    private JSONObject history(HistoryComparison h) {
        JSONObject o = new JSONObject();
        o.put("has_history", h.hasHistory);
        o.put("days_count", h.daysCount);
        if (!h.hasHistory) {
            return o;
        }
        o.put("avg_total_score", h.avgTotalScore);
        o.put("avg_zero_ratio", h.avgZeroRatio);
        o.put("avg_plus2_ratio", h.avgPlus2Ratio);
        o.put("avg_minus2_ratio", h.avgMinus2Ratio);
        o.put("current_total_score", h.currentTotalScore);
        o.put("current_zero_ratio", h.currentZeroRatio);
        o.put("current_plus2_ratio", h.currentPlus2Ratio);
        o.put("current_minus2_ratio", h.currentMinus2Ratio);
        return o;
    }
}
