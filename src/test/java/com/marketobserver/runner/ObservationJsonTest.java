package com.marketobserver.runner;

import com.marketobserver.model.AggregateRecord;
import com.marketobserver.model.Alert;
import com.marketobserver.model.AlertType;
import com.marketobserver.model.Category;
import com.marketobserver.model.ClassifiedItem;
import com.marketobserver.model.Classification;
import com.marketobserver.model.HistoryComparison;
import com.marketobserver.model.NewsItem;
import com.marketobserver.model.Origin;
import com.marketobserver.model.PoliticalEvent;
import com.marketobserver.model.PriorityMacro;
import com.marketobserver.model.PriorityTopic;
import com.marketobserver.model.ScoredItem;
import com.marketobserver.model.Severity;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ObservationJsonTest {

    private final ObservationJson json = new ObservationJson();

    @Test
    void item_shouldPassMetadataThroughAndAddScoringFields() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("title", "M&A速報");
        metadata.put("url", "https://example.com/m");
        metadata.put("author", null);
        metadata.put("source", "Reuters");
        ScoredItem item = new ScoredItem(
                new ClassifiedItem(new NewsItem("買収を発表", Origin.FOREIGN, metadata), new Classification(Category.THEME, "M&A")),
                0,
                "市場影響が限定的と判断"
        );

        JSONObject o = json.item(item);

        assertEquals("M&A速報", o.getString("title"));
        assertEquals("https://example.com/m", o.getString("url"));
        assertTrue(o.isNull("author"));
        assertEquals("foreign", o.getString("origin"));
        assertEquals("Reuters", o.getString("source"));
        assertEquals("theme", o.getString("category"));
        assertEquals("テーマ", o.getString("category_name"));
        assertEquals("M&A", o.getString("sub_category"));
        assertEquals(0, o.getInt("impact_score"));
        assertEquals("市場影響が限定的と判断", o.getString("score_reason"));
    }

    @Test
    void toJson_shouldRenderAlertsWithWireNamesAndOmitEmptyHistoryAverages() {
        ObservationResult result = ObservationResult.builder()
                .date(LocalDate.of(2026, 10, 19))
                .aggregate(AggregateRecord.builder().totalScore(1.5).newsCount(2).build())
                .alerts(List.of(new Alert(AlertType.DAILY_CHANGE, Severity.WARNING, "変化")))
                .history(HistoryComparison.none())
                .summary("特に大きな動きがない日です。")
                .submittedCount(3)
                .scoredCount(2)
                .build();

        JSONObject root = json.toJson(result);

        assertEquals("2026-10-19", root.getString("date"));
        assertEquals(1, root.getInt("skipped_count"));
        assertEquals(1.5, root.getJSONObject("aggregate").getDouble("total_score"), 1e-9);
        JSONObject alert = root.getJSONArray("alerts").getJSONObject(0);
        assertEquals(AlertType.DAILY_CHANGE.wireName(), alert.getString("type"));
        assertEquals("warning", alert.getString("severity"));
        JSONObject history = root.getJSONObject("history");
        assertFalse(history.getBoolean("has_history"));
        assertFalse(history.has("avg_total_score"));
        assertEquals(0, root.getJSONArray("items").length());
        assertFalse(root.getBoolean("has_priority"));
        assertEquals(0, root.getJSONObject("priority_macro").getJSONObject("fed").getInt("count"));
        assertEquals(0, root.getJSONArray("political_events").length());
    }

    @Test
    void priorityMacro_shouldRenderEveryTopicWithSampleArticles() {
        ScoredItem titled = scored("FOMC holds rates", Map.of("title", "FOMC据え置き", "url", "https://example.com/f", "source_name", "Nikkei"), 2);
        ScoredItem untitled = scored("Powell signals patience", Map.of(), 1);
        Map<PriorityTopic, List<ScoredItem>> topics = new EnumMap<>(PriorityTopic.class);
        topics.put(PriorityTopic.FED, List.of(titled, untitled));

        JSONObject o = json.priorityMacro(new PriorityMacro(topics));

        JSONObject fed = o.getJSONObject("fed");
        assertEquals(2, fed.getInt("count"));
        assertTrue(fed.getBoolean("has"));
        assertEquals(1.5, fed.getDouble("avg_score"), 1e-9);
        assertEquals("FRB関連: やや買い寄りの内容（平均スコア +1.5）", fed.getString("summary"));
        JSONArray articles = fed.getJSONArray("articles");
        assertEquals("FOMC据え置き", articles.getJSONObject(0).getString("title"));
        assertEquals("Nikkei", articles.getJSONObject(0).getString("source_name"));
        assertEquals("Powell signals patience", articles.getJSONObject(1).getString("title"));
        assertTrue(articles.getJSONObject(1).isNull("url"));
        assertEquals("", articles.getJSONObject(1).getString("source_name"));
        assertFalse(o.getJSONObject("dxy").getBoolean("has"));
        assertEquals("", o.getJSONObject("dxy").getString("summary"));
    }

    @Test
    void politicalEvents_shouldGroupBySpeakerAndDropRepeatedSummaries() {
        PoliticalEvent first = new PoliticalEvent(scored("Trump tariff plan", Map.of("source_name", "Reuters"), -2),
                "トランプ大統領", "関税政策", "関税変更に関する発言", List.of("tariff"));
        PoliticalEvent repeat = new PoliticalEvent(scored("Trump tariff again", Map.of("source_name", "Bloomberg"), -2),
                "トランプ大統領", "関税政策", "関税変更に関する発言", List.of("tariff"));
        PoliticalEvent powell = new PoliticalEvent(scored("Powell on rate cut", Map.of(), 0),
                "パウエルFRB議長", "金融政策", "FRBに対する利下げ圧力を示唆", List.of("rate cut"));

        JSONArray groups = json.politicalEvents(List.of(first, powell, repeat));

        assertEquals(2, groups.length());
        JSONObject trump = groups.getJSONObject(0);
        assertEquals("トランプ大統領", trump.getString("speaker"));
        assertEquals(1, trump.getJSONArray("articles").length());
        assertEquals(1, trump.getInt("count"));
        assertEquals("Trump tariff plan", trump.getJSONArray("articles").getJSONObject(0).getString("description"));
        assertEquals(2, trump.getJSONArray("themes").getJSONObject(0).getInt("count"));
        assertEquals(List.of("Reuters", "Bloomberg"), trump.getJSONArray("sources").toList());
        JSONObject fed = groups.getJSONObject(1);
        assertEquals("パウエルFRB議長", fed.getString("speaker"));
        assertEquals(List.of("Unknown"), fed.getJSONArray("sources").toList());
    }

    private static ScoredItem scored(String text, Map<String, Object> metadata, int score) {
        return new ScoredItem(new ClassifiedItem(new NewsItem(text, Origin.FOREIGN, metadata), Classification.market()), score, "理由");
    }
}
