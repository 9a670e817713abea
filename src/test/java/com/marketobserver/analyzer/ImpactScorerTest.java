package com.marketobserver.analyzer;

import com.marketobserver.config.KeywordTables;
import com.marketobserver.model.Category;
import com.marketobserver.model.ClassifiedItem;
import com.marketobserver.model.Classification;
import com.marketobserver.model.NewsItem;
import com.marketobserver.model.Origin;
import com.marketobserver.model.ScoredItem;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImpactScorerTest {

    private final KeywordTables tables = KeywordTables.defaults();
    private final TextClassifier classifier = new TextClassifier(tables);
    private final ImpactScorer scorer = new ImpactScorer(tables);

    @Test
    void score_shouldApplyMarketFactorAndTruncate() {
        ScoredItem scored = scorer.score(classifier.classify(new NewsItem("株価が急騰した", Origin.DOMESTIC)));

        assertEquals(Category.MARKET, scored.category());
        assertEquals(3, scored.impactScore);
        assertTrue(scored.reason.contains("急騰"), scored.reason);
        assertEquals("やや好材料（急騰）", scored.reason);
    }

    @Test
    void score_shouldApplyForeignFactorAfterCategoryFactor() {
        ScoredItem scored = scorer.score(item("record high surge", Category.MARKET, Origin.FOREIGN));

        // 6 * 1.2 = 7.2 -> 7, then 7 * 1.1 = 7.7 -> 7
        assertEquals(7, scored.impactScore);
        assertEquals("強い好材料あり（record high, surge）", scored.reason);
    }

    @Test
    void score_shouldTruncateTowardZeroForNegativeScores() {
        ScoredItem scored = scorer.score(item("株価が急落", Category.THEME, Origin.DOMESTIC));

        assertEquals(-2, scored.impactScore);
        assertEquals("やや懸念材料（急落）", scored.reason);
    }

    @Test
    void score_shouldDampenThemeItems() {
        ScoredItem scored = scorer.score(item("増益を確保", Category.THEME, Origin.DOMESTIC));

        assertEquals(1, scored.impactScore);
        assertEquals("弱い好材料の示唆（増益）", scored.reason);
    }

    @Test
    void score_shouldClampToUpperBound() {
        ScoredItem scored = scorer.score(item(
                "過去最高 急騰 大幅上昇 予想上回る record high surge",
                Category.MARKET,
                Origin.FOREIGN
        ));

        assertEquals(ImpactScorer.SCORE_MAX, scored.impactScore);
        assertEquals("強い好材料あり（過去最高, 急騰, 大幅上昇）", scored.reason);
    }

    @Test
    void score_shouldClampToLowerBound() {
        ScoredItem scored = scorer.score(item("暴落 急落 危機 破綻 デフォルト crash", Category.MARKET, Origin.DOMESTIC));

        assertEquals(ImpactScorer.SCORE_MIN, scored.impactScore);
        assertEquals("強い懸念材料あり（暴落, 急落, 危機）", scored.reason);
    }

    @Test
    void score_shouldStayInRangeForAnyKeywordPair() {
        List<String> pos = List.copyOf(tables.positiveWeights().keySet());
        List<String> neg = List.copyOf(tables.negativeWeights().keySet());
        for (Category category : Category.values()) {
            for (Origin origin : Origin.values()) {
                for (String p : pos) {
                    for (String n : neg) {
                        int s = scorer.score(item(p + " " + n + " " + p, category, origin)).impactScore;
                        assertTrue(s >= ImpactScorer.SCORE_MIN && s <= ImpactScorer.SCORE_MAX, p + "/" + n + " -> " + s);
                    }
                }
            }
        }
    }

    @Test
    void score_shouldExplainMixedZero() {
        ScoredItem scored = scorer.score(item("上昇と下落が交錯", Category.SECTOR, Origin.DOMESTIC));

        assertEquals(0, scored.impactScore);
        assertEquals("好悪材料が混在（+: 上昇 / -: 下落）", scored.reason);
    }

    @Test
    void score_shouldExplainOneSidedZero() {
        ScoredItem scored = scorer.score(item("業績は安定", Category.THEME, Origin.DOMESTIC));

        assertEquals(0, scored.impactScore);
        assertEquals(ScoreReasonBuilder.ONE_SIDED_ZERO_REASON, scored.reason);
    }

    @Test
    void score_shouldPickStableNeutralReasonWhenNothingMatches() {
        ScoredItem first = scorer.score(item("新店舗の開業イベント", Category.MARKET, Origin.DOMESTIC));
        ScoredItem second = scorer.score(item("新店舗の開業イベント", Category.MARKET, Origin.DOMESTIC));

        assertEquals(0, first.impactScore);
        assertTrue(ScoreReasonBuilder.NEUTRAL_REASONS.contains(first.reason), first.reason);
        assertEquals(first.reason, second.reason);
    }

    @Test
    void score_shouldIgnoreCaseForEnglishKeywords() {
        ScoredItem scored = scorer.score(item("Stocks RALLY on growth", Category.SECTOR, Origin.DOMESTIC));

        assertEquals(4, scored.impactScore);
    }

    @Test
    void scoreBatch_shouldSkipFailingItem() {
        List<ClassifiedItem> items = Arrays.asList(
                item("急騰", Category.SECTOR, Origin.DOMESTIC),
                null,
                item("急落", Category.SECTOR, Origin.DOMESTIC)
        );

        List<ScoredItem> out = scorer.scoreBatch(items);

        assertEquals(2, out.size());
        assertEquals(3, out.get(0).impactScore);
        assertEquals(-3, out.get(1).impactScore);
    }

    private static ClassifiedItem item(String text, Category category, Origin origin) {
        return new ClassifiedItem(new NewsItem(text, origin), new Classification(category, null));
    }
}
