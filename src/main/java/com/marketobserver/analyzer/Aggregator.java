package com.marketobserver.analyzer;

import com.marketobserver.core.Decimals;
import com.marketobserver.model.AggregateRecord;
import com.marketobserver.model.BatchRatios;
import com.marketobserver.model.Origin;
import com.marketobserver.model.ScoredItem;

import java.util.List;

/**
 * Reduces a scored batch into per-origin means and bucket ratios.
 */
public final class Aggregator {

    public AggregateRecord aggregate(List<ScoredItem> items) {
        if (items == null || items.isEmpty()) {
            return AggregateRecord.empty();
        }
        long total = 0L;
        long domesticSum = 0L;
        long foreignSum = 0L;
        int domesticCount = 0;
        int foreignCount = 0;
        int zeroCount = 0;
        for (ScoredItem item : items) {
            total += item.impactScore;
            if (item.origin() == Origin.FOREIGN) {
                foreignSum += item.impactScore;
                foreignCount++;
            } else {
                domesticSum += item.impactScore;
                domesticCount++;
            }
            if (item.impactScore == 0) {
                zeroCount++;
            }
        }
        double totalAvg = (double) total / items.size();
        double domesticAvg = mean(domesticSum, domesticCount);
        double foreignAvg = mean(foreignSum, foreignCount);

        return AggregateRecord.builder()
                .totalScore(Decimals.round1(totalAvg))
                .domesticScore(Decimals.round1(domesticAvg))
                .foreignScore(Decimals.round1(foreignAvg))
                .domesticForeignGap(Decimals.round1(domesticAvg - foreignAvg))
                .newsCount(items.size())
                .zeroScoreCount(zeroCount)
                .build();
    }

    /**
     * Percent of the batch with score 0, score >= 2, score <= -2, and macro mentions.
     */
    public BatchRatios ratios(List<ScoredItem> items, int macroCount) {
        if (items == null || items.isEmpty()) {
            return BatchRatios.empty();
        }
        int zero = 0;
        int plus2 = 0;
        int minus2 = 0;
        for (ScoredItem item : items) {
            if (item.impactScore == 0) {
                zero++;
            } else if (item.impactScore >= 2) {
                plus2++;
            } else if (item.impactScore <= -2) {
                minus2++;
            }
        }
        int n = items.size();
        return new BatchRatios(
                percent(zero, n),
                percent(plus2, n),
                percent(minus2, n),
                percent(Math.max(0, macroCount), n)
        );
    }

    private double mean(long sum, int count) {
        return count == 0 ? 0.0 : (double) sum / count;
    }

    private double percent(int part, int whole) {
        return whole <= 0 ? 0.0 : part * 100.0 / whole;
    }
}
