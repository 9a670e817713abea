package com.marketobserver.analyzer;

import com.marketobserver.model.PriorityMacro;
import com.marketobserver.model.PriorityTopic;
import com.marketobserver.model.ScoredItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：PriorityMacroDetector（class）。
 * 主要职责：识别联储、美债、美元/日元、美元指数、就业、通胀、ISM 相关条目，作为当日判断的基础信息。
 * 使用建议：只做识别，不改变影响分；一条新闻可同时落入多个主题。
 */
public final class PriorityMacroDetector {
    static final Map<PriorityTopic, List<String>> KEYWORDS = buildKeywords();

    public PriorityMacro detect(List<ScoredItem> items) {
        Map<PriorityTopic, List<ScoredItem>> out = new EnumMap<>(PriorityTopic.class);
        for (PriorityTopic topic : PriorityTopic.values()) {
            out.put(topic, new ArrayList<>());
        }
        if (items == null) {
            return new PriorityMacro(out);
        }
        for (ScoredItem item : items) {
            String lower = TextClassifier.lower(item.text());
            for (Map.Entry<PriorityTopic, List<String>> e : KEYWORDS.entrySet()) {
                if (TextClassifier.containsAny(lower, e.getValue())) {
                    out.get(e.getKey()).add(item);
                }
            }
        }
        return new PriorityMacro(out);
    }

    private static Map<PriorityTopic, List<String>> buildKeywords() {
        Map<PriorityTopic, List<String>> k = new EnumMap<>(PriorityTopic.class);
        k.put(PriorityTopic.FED, List.of(
                "federal reserve", "fed", "frb", "fomc",
                "powell", "パウエル", "連邦準備", "中央銀行",
                "rate decision", "金利決定"
        ));
        k.put(PriorityTopic.TREASURY, List.of(
                "treasury yield", "10-year yield", "2-year yield",
                "bond yield", "米国債", "利回り", "長期金利"
        ));
        // intervention and rate-check wording counts as yen news
        k.put(PriorityTopic.USDJPY, List.of(
                "usd/jpy", "dollar yen", "ドル円", "円安", "円高",
                "yen", "円", "usdjpy",
                "rate check", "レートチェック", "forex intervention", "為替介入",
                "intervention", "介入警戒", "口先介入", "verbal intervention",
                "boj intervention", "日銀介入", "mof intervention", "財務省介入",
                "kanda", "神田財務官", "三者会合"
        ));
        k.put(PriorityTopic.DXY, List.of("dollar index", "dxy", "ドル指数"));
        k.put(PriorityTopic.EMPLOYMENT, List.of(
                "nonfarm payroll", "payroll", "雇用統計",
                "jobs report", "unemployment", "失業率",
                "employment", "jobless claims"
        ));
        k.put(PriorityTopic.INFLATION, List.of(
                "cpi", "consumer price", "消費者物価",
                "pce", "pce deflator", "inflation", "インフレ",
                "producer price", "ppi"
        ));
        k.put(PriorityTopic.ISM, List.of(
                "ism", "pmi", "景況感", "manufacturing",
                "services pmi", "製造業景況"
        ));
        return Collections.unmodifiableMap(k);
    }
}
