package com.marketobserver.analyzer;

import com.marketobserver.model.PoliticalEvent;
import com.marketobserver.model.ScoredItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags items where a known speaker talks about tariffs, trade, rates, sanctions or foreign
 * policy. Nothing here is scored; events are surfaced as possible market triggers.
 */
public final class PoliticalEventDetector {
    static final String FALLBACK_SUMMARY = "市場感応度の高い発言";

    // first matching speaker wins, so longer forms behind "trump" never win on their own
    static final Map<String, String> SPEAKERS = orderedMap(
            "trump", "トランプ大統領",
            "president trump", "トランプ大統領",
            "donald trump", "トランプ大統領",
            "biden", "バイデン前大統領",
            "powell", "パウエルFRB議長",
            "yellen", "イエレン財務長官"
    );

    static final Map<String, String> SENSITIVE_CONTEXTS = orderedMap(
            "tariff", "関税政策",
            "tariffs", "関税政策",
            "関税", "関税政策",
            "trade", "貿易政策",
            "trade war", "貿易政策",
            "貿易", "貿易政策",
            "china", "対中国政策",
            "中国", "対中国政策",
            "nato", "外交・安全保障",
            "greenland", "外交・安全保障",
            "canada", "対北米政策",
            "mexico", "対北米政策",
            "fed", "金融政策",
            "federal reserve", "金融政策",
            "frb", "金融政策",
            "interest rate", "金融政策",
            "rate cut", "金融政策",
            "rate hike", "金融政策",
            "金利", "金融政策",
            "sanction", "経済制裁",
            "制裁", "経済制裁"
    );

    private static final String DEFAULT_KEY = "default";
    private static final Map<String, Map<String, String>> SUMMARIES = buildSummaries();

    public List<PoliticalEvent> detect(List<ScoredItem> items) {
        List<PoliticalEvent> events = new ArrayList<>();
        if (items == null) {
            return events;
        }
        for (ScoredItem item : items) {
            String lower = TextClassifier.lower(item.text());
            String speaker = firstSpeaker(lower);
            if (speaker == null) {
                continue;
            }
            List<String> keywords = new ArrayList<>();
            String context = null;
            for (Map.Entry<String, String> e : SENSITIVE_CONTEXTS.entrySet()) {
                if (lower.contains(e.getKey())) {
                    keywords.add(e.getKey());
                    if (context == null) {
                        context = e.getValue();
                    }
                }
            }
            if (keywords.isEmpty()) {
                continue;
            }
            events.add(new PoliticalEvent(item, speaker, context, summarize(context, keywords), keywords));
        }
        return events;
    }

    /**
     * Uses the template of the first detected keyword that has one, else the context default.
     */
    static String summarize(String context, List<String> keywords) {
        Map<String, String> templates = SUMMARIES.get(context);
        if (templates == null) {
            return FALLBACK_SUMMARY;
        }
        for (String kw : keywords) {
            String hit = templates.get(kw);
            if (hit != null) {
                return hit;
            }
        }
        return templates.getOrDefault(DEFAULT_KEY, FALLBACK_SUMMARY);
    }

    private String firstSpeaker(String lower) {
        for (Map.Entry<String, String> e : SPEAKERS.entrySet()) {
            if (lower.contains(e.getKey())) {
                return e.getValue();
            }
        }
        return null;
    }

    private static Map<String, String> orderedMap(String... pairs) {
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            out.put(pairs[i], pairs[i + 1]);
        }
        return Collections.unmodifiableMap(out);
    }

    private static Map<String, Map<String, String>> buildSummaries() {
        Map<String, Map<String, String>> s = new LinkedHashMap<>();
        s.put("関税政策", orderedMap(
                "tariff", "関税変更に関する発言",
                DEFAULT_KEY, "関税政策に関する発言"));
        s.put("貿易政策", orderedMap(
                "trade war", "貿易摩擦に関する発言",
                DEFAULT_KEY, "貿易政策に関する発言"));
        s.put("対中国政策", orderedMap(DEFAULT_KEY, "対中国政策に関する発言"));
        s.put("金融政策", orderedMap(
                "rate cut", "FRBに対する利下げ圧力を示唆",
                "rate hike", "金利上昇への言及",
                "fed", "中央銀行政策への言及",
                DEFAULT_KEY, "金融政策に関する発言"));
        s.put("外交・安全保障", orderedMap(
                "greenland", "グリーンランドに関する発言",
                "nato", "NATO同盟に関する発言",
                DEFAULT_KEY, "外交・安全保障に関する発言"));
        s.put("対北米政策", orderedMap(DEFAULT_KEY, "北米諸国への政策発言"));
        s.put("経済制裁", orderedMap(DEFAULT_KEY, "経済制裁に関する発言"));
        return Collections.unmodifiableMap(s);
    }
}
