package com.marketobserver.config;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable keyword tables shared by the classifier, the scorer and the macro observer.
 * Built once at startup and passed explicitly into each component.
 */
public final class KeywordTables {
    private static final KeywordTables DEFAULTS = buildDefaults();

    private final List<String> marketKeywords;
    private final Map<String, List<String>> sectorGroups;
    private final Map<String, List<String>> themeGroups;
    private final Map<String, Integer> positiveWeights;
    private final Map<String, Integer> negativeWeights;
    private final List<String> fxKeywords;
    private final List<String> ratesKeywords;
    private final List<String> dataKeywords;

    private KeywordTables(
            List<String> marketKeywords,
            Map<String, List<String>> sectorGroups,
            Map<String, List<String>> themeGroups,
            Map<String, Integer> positiveWeights,
            Map<String, Integer> negativeWeights,
            List<String> fxKeywords,
            List<String> ratesKeywords,
            List<String> dataKeywords
    ) {
        this.marketKeywords = List.copyOf(marketKeywords);
        this.sectorGroups = copyGroups(sectorGroups);
        this.themeGroups = copyGroups(themeGroups);
        this.positiveWeights = Collections.unmodifiableMap(new LinkedHashMap<>(positiveWeights));
        this.negativeWeights = Collections.unmodifiableMap(new LinkedHashMap<>(negativeWeights));
        this.fxKeywords = List.copyOf(fxKeywords);
        this.ratesKeywords = List.copyOf(ratesKeywords);
        this.dataKeywords = List.copyOf(dataKeywords);
    }

    public static KeywordTables defaults() {
        return DEFAULTS;
    }

    /**
     * Resolves the tables for a run: built-in defaults unless {@code keywords.path} names an override file.
     */
    public static KeywordTables fromConfig(Config config) {
        String raw = config == null ? "" : config.getString("keywords.path");
        if (raw.isEmpty()) {
            return DEFAULTS;
        }
        return load(config.getPath("keywords.path"));
    }

    /**
     * Reads a JSON override file. Sections missing from the file keep their defaults.
     *
     * @throws IllegalArgumentException when the file cannot be read or is not a JSON object
     */
    public static KeywordTables load(Path path) {
        String txt;
        try {
            txt = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalArgumentException("failed to read keyword tables: " + path + ", err=" + e.getMessage(), e);
        }
        try {
            return fromJson(new JSONObject(txt));
        } catch (JSONException e) {
            throw new IllegalArgumentException("invalid keyword tables: " + path + ", err=" + e.getMessage(), e);
        }
    }

    public static KeywordTables fromJson(JSONObject root) {
        KeywordTables base = DEFAULTS;
        if (root == null) {
            return base;
        }
        return new KeywordTables(
                root.has("market") ? readList(root.getJSONArray("market")) : base.marketKeywords,
                root.has("sector") ? readGroups("sector", root.get("sector")) : base.sectorGroups,
                root.has("theme") ? readGroups("theme", root.get("theme")) : base.themeGroups,
                root.has("positive") ? readWeights(root.getJSONObject("positive")) : base.positiveWeights,
                root.has("negative") ? readWeights(root.getJSONObject("negative")) : base.negativeWeights,
                root.has("macro_fx") ? readList(root.getJSONArray("macro_fx")) : base.fxKeywords,
                root.has("macro_rates") ? readList(root.getJSONArray("macro_rates")) : base.ratesKeywords,
                root.has("macro_data") ? readList(root.getJSONArray("macro_data")) : base.dataKeywords
        );
    }

    public List<String> marketKeywords() {
        return marketKeywords;
    }

    public Map<String, List<String>> sectorGroups() {
        return sectorGroups;
    }

    public Map<String, List<String>> themeGroups() {
        return themeGroups;
    }

    public Map<String, Integer> positiveWeights() {
        return positiveWeights;
    }

    public Map<String, Integer> negativeWeights() {
        return negativeWeights;
    }

    public List<String> fxKeywords() {
        return fxKeywords;
    }

    public List<String> ratesKeywords() {
        return ratesKeywords;
    }

    public List<String> dataKeywords() {
        return dataKeywords;
    }

    private static List<String> readList(JSONArray array) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            String kw = array.optString(i, "").trim();
            if (!kw.isEmpty()) {
                out.add(kw);
            }
        }
        return out;
    }

    /**
     * Groups are tried in order and the first match wins. An array of
     * {@code {"name": ..., "keywords": [...]}} keeps the file's order; an object keyed by
     * group name has no order of its own and is applied in sorted-name order.
     */
    private static Map<String, List<String>> readGroups(String section, Object raw) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        if (raw instanceof JSONArray array) {
            for (int i = 0; i < array.length(); i++) {
                JSONObject group = array.getJSONObject(i);
                String name = group.getString("name").trim();
                if (name.isEmpty()) {
                    throw new IllegalArgumentException("keyword group without name: " + section + "[" + i + "]");
                }
                out.put(name, readList(group.getJSONArray("keywords")));
            }
            return out;
        }
        if (raw instanceof JSONObject object) {
            List<String> names = new ArrayList<>(object.keySet());
            Collections.sort(names);
            for (String name : names) {
                out.put(name, readList(object.getJSONArray(name)));
            }
            return out;
        }
        throw new IllegalArgumentException("keyword groups must be an array or an object: " + section);
    }

    private static Map<String, Integer> readWeights(JSONObject object) {
        Map<String, Integer> out = new LinkedHashMap<>();
        List<String> names = new ArrayList<>(object.keySet());
        Collections.sort(names);
        for (String kw : names) {
            int weight = object.getInt(kw);
            if (weight < -3 || weight > 3) {
                throw new IllegalArgumentException("keyword weight out of range [-3,3]: " + kw + "=" + weight);
            }
            out.put(kw, weight);
        }
        return out;
    }

    private static Map<String, List<String>> copyGroups(Map<String, List<String>> groups) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : groups.entrySet()) {
            copy.put(e.getKey(), List.copyOf(e.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static KeywordTables buildDefaults() {
        List<String> market = List.of(
                "日経平均", "TOPIX", "ダウ", "S&P", "ナスダック", "NASDAQ",
                "FRB", "日銀", "金融政策", "金利", "円安", "円高",
                "GDP", "インフレ", "CPI", "雇用統計", "景気",
                "利上げ", "利下げ", "量的緩和", "QE"
        );

        Map<String, List<String>> sector = new LinkedHashMap<>();
        sector.put("テクノロジー", List.of("AI", "半導体", "クラウド", "ソフトウェア", "IT", "エヌビディア", "NVIDIA"));
        sector.put("金融", List.of("銀行", "証券", "保険", "メガバンク", "金融機関"));
        sector.put("自動車", List.of("自動車", "EV", "電気自動車", "トヨタ", "ホンダ"));
        sector.put("不動産", List.of("不動産", "REIT", "住宅"));
        sector.put("エネルギー", List.of("原油", "石油", "ガス", "電力", "再エネ"));
        sector.put("ヘルスケア", List.of("製薬", "医療", "バイオ", "ヘルスケア"));
        sector.put("消費", List.of("小売", "消費", "EC", "通販"));

        Map<String, List<String>> theme = new LinkedHashMap<>();
        theme.put("地政学リスク", List.of("戦争", "紛争", "制裁", "地政学", "ウクライナ", "中東", "台湾"));
        theme.put("規制・政策", List.of("規制", "法案", "法律", "独禁法", "規制緩和"));
        theme.put("決算・業績", List.of("決算", "業績", "売上", "利益", "増収", "減益"));
        theme.put("M&A", List.of("買収", "合併", "M&A", "TOB", "統合"));

        Map<String, Integer> positive = new LinkedHashMap<>();
        // strong
        positive.put("過去最高", 3);
        positive.put("急騰", 3);
        positive.put("大幅上昇", 3);
        positive.put("予想上回る", 3);
        positive.put("beat expectations", 3);
        positive.put("record high", 3);
        positive.put("surge", 3);
        positive.put("利下げ", 2);
        positive.put("金融緩和", 2);
        positive.put("景気回復", 2);
        positive.put("rate cut", 2);
        positive.put("easing", 2);
        positive.put("recovery", 2);
        // medium
        positive.put("上昇", 2);
        positive.put("増益", 2);
        positive.put("好調", 2);
        positive.put("改善", 2);
        positive.put("成長", 2);
        positive.put("買い越し", 2);
        positive.put("需要増", 2);
        positive.put("rise", 2);
        positive.put("growth", 2);
        positive.put("gains", 2);
        positive.put("rally", 2);
        // weak
        positive.put("堅調", 1);
        positive.put("安定", 1);
        positive.put("維持", 1);
        positive.put("底堅い", 1);
        positive.put("stable", 1);
        positive.put("steady", 1);

        Map<String, Integer> negative = new LinkedHashMap<>();
        // strong
        negative.put("暴落", -3);
        negative.put("急落", -3);
        negative.put("危機", -3);
        negative.put("破綻", -3);
        negative.put("デフォルト", -3);
        negative.put("crash", -3);
        negative.put("plunge", -3);
        negative.put("crisis", -3);
        negative.put("default", -3);
        negative.put("利上げ", -2);
        negative.put("金融引き締め", -2);
        negative.put("リセッション", -2);
        negative.put("rate hike", -2);
        negative.put("tightening", -2);
        negative.put("recession", -2);
        // medium
        negative.put("下落", -2);
        negative.put("減益", -2);
        negative.put("悪化", -2);
        negative.put("低下", -2);
        negative.put("減少", -2);
        negative.put("売り越し", -2);
        negative.put("需要減", -2);
        negative.put("インフレ懸念", -2);
        negative.put("decline", -2);
        negative.put("drop", -2);
        negative.put("fall", -2);
        negative.put("loss", -2);
        negative.put("tariff", -2);
        // weak
        negative.put("軟調", -1);
        negative.put("弱含み", -1);
        negative.put("警戒", -1);
        negative.put("懸念", -1);
        negative.put("uncertainty", -1);
        negative.put("concern", -1);
        negative.put("cautious", -1);

        List<String> fx = List.of(
                "dollar", "yen", "usd/jpy", "exchange rate", "currency",
                "ドル", "円", "為替", "円安", "円高", "ドル高", "ドル安",
                "euro", "eur", "gbp", "pound"
        );
        List<String> rates = List.of(
                "treasury", "yield", "bond", "interest rate", "10-year",
                "国債", "金利", "利回り", "長期金利", "短期金利",
                "jgb", "bund", "gilt"
        );
        List<String> data = List.of(
                "cpi", "inflation", "jobs report", "employment", "gdp",
                "pce", "nonfarm payroll", "unemployment", "retail sales",
                "consumer price", "producer price", "pmi", "ism",
                "インフレ", "消費者物価", "雇用統計", "失業率"
        );

        return new KeywordTables(market, sector, theme, positive, negative, fx, rates, data);
    }
}
