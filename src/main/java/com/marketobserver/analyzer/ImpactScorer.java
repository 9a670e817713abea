package com.marketobserver.analyzer;

import com.marketobserver.config.KeywordTables;
import com.marketobserver.model.Category;
import com.marketobserver.model.ClassifiedItem;
import com.marketobserver.model.Origin;
import com.marketobserver.model.ScoredItem;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 模块说明：ImpactScorer（class）。
 * 主要职责：按关键词权重求和，依次乘以类别系数与来源系数（均向零截断），最后截断到 [-10, 10]。
 * 使用建议：纯函数，无状态；批量打分时各条目互不影响。
 */
public final class ImpactScorer {
    private static final Logger LOG = LogManager.getLogger(ImpactScorer.class);

    public static final int SCORE_MIN = -10;
    public static final int SCORE_MAX = 10;

    private final KeywordTables tables;
    private final ScoreReasonBuilder reasonBuilder;

    public ImpactScorer(KeywordTables tables) {
        this(tables, new ScoreReasonBuilder());
    }

    public ImpactScorer(KeywordTables tables, ScoreReasonBuilder reasonBuilder) {
        this.tables = tables == null ? KeywordTables.defaults() : tables;
        this.reasonBuilder = reasonBuilder == null ? new ScoreReasonBuilder() : reasonBuilder;
    }

/**
 * 方法说明：score，负责计算单条新闻的影响分与理由。
 * 处理流程：关键词不去重、不提前退出；截断是最后一步，保证结果恒在区间内。
 * 维护提示：理由文案只依赖命中词与分数区间。
 */
    public ScoredItem score(ClassifiedItem item) {
        if (item == null) {
            throw new IllegalArgumentException("item must not be null");
        }
        String lower = item.text().toLowerCase(Locale.ROOT);
        List<String> matchedPositive = new ArrayList<>();
        List<String> matchedNegative = new ArrayList<>();

        int raw = sumMatched(lower, tables.positiveWeights(), matchedPositive)
                + sumMatched(lower, tables.negativeWeights(), matchedNegative);

        int score = (int) (raw * categoryFactor(item.category()));
        score = (int) (score * originFactor(item.origin()));
        score = clamp(score);

        String reason = reasonBuilder.build(score, matchedPositive, matchedNegative, item.text());
        return new ScoredItem(item, score, reason);
    }

    /**
     * Scores items independently. A failing item is skipped and logged; the returned list
     * holds only the items that were scored.
     */
    public List<ScoredItem> scoreBatch(List<ClassifiedItem> items) {
        List<ScoredItem> out = new ArrayList<>();
        if (items == null) {
            return out;
        }
        for (int i = 0; i < items.size(); i++) {
            try {
                out.add(score(items.get(i)));
            } catch (RuntimeException e) {
                LOG.warn("score skipped item index={} err={}", i, e.toString());
            }
        }
        return out;
    }

    static double categoryFactor(Category category) {
        if (category == null) {
            return 1.0;
        }
        switch (category) {
            case MARKET:
                return 1.2;
            case THEME:
                return 0.8;
            case SECTOR:
            default:
                return 1.0;
        }
    }

    static double originFactor(Origin origin) {
        return origin == Origin.FOREIGN ? 1.1 : 1.0;
    }

    static int clamp(int value) {
        if (value < SCORE_MIN) {
            return SCORE_MIN;
        }
        if (value > SCORE_MAX) {
            return SCORE_MAX;
        }
        return value;
    }

    private int sumMatched(String lower, Map<String, Integer> weights, List<String> matched) {
        int sum = 0;
        for (Map.Entry<String, Integer> e : weights.entrySet()) {
            if (lower.contains(e.getKey().toLowerCase(Locale.ROOT))) {
                sum += e.getValue();
                matched.add(e.getKey());
            }
        }
        return sum;
    }
}
