package com.marketobserver.alert;

import com.marketobserver.core.Decimals;
import com.marketobserver.model.AggregateRecord;
import com.marketobserver.model.Alert;
import com.marketobserver.model.AlertType;
import com.marketobserver.model.HistoryEntry;
import com.marketobserver.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Day-over-day and windowed change detection over aggregate scores.
 * <p>
 * Keeps an append-only list of prior aggregates for the lifetime of the instance.
 * Callers that need continuity across runs feed persisted history through {@link #seed}.
 */
public final class AlertDetector {
    public static final double DAILY_CHANGE_THRESHOLD = 3.0;
    public static final double DAILY_CHANGE_WARNING = 5.0;
    public static final int MA_WINDOW = 3;
    public static final double DOMESTIC_FOREIGN_GAP_THRESHOLD = 5.0;

    private final List<AggregateRecord> history = new ArrayList<>();
    private final int window;

    public AlertDetector() {
        this(MA_WINDOW);
    }

    AlertDetector(int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.window = window;
    }

    /**
     * Appends unconditionally; two calls for the same day produce two records.
     */
    public void addDailyScore(AggregateRecord aggregate) {
        if (aggregate != null) {
            history.add(aggregate);
        }
    }

    /**
     * Replays persisted daily totals, oldest first. Only the total score is known for
     * persisted days, so the other fields of the replayed records stay zero.
     */
    public void seed(List<HistoryEntry> entries) {
        if (entries == null) {
            return;
        }
        for (HistoryEntry entry : entries) {
            history.add(AggregateRecord.builder()
                    .totalScore(entry.totalScore)
                    .newsCount(entry.newsCount)
                    .build());
        }
    }

    public List<AggregateRecord> history() {
        return List.copyOf(history);
    }

    public List<Alert> detectAlerts(AggregateRecord current) {
        AggregateRecord cur = current == null ? AggregateRecord.empty() : current;
        List<Alert> alerts = new ArrayList<>();

        if (!history.isEmpty()) {
            double prev = history.get(history.size() - 1).totalScore;
            double delta = Decimals.round1(cur.totalScore - prev);
            if (Math.abs(delta) >= DAILY_CHANGE_THRESHOLD) {
                String direction = delta > 0 ? "上昇" : "下落";
                alerts.add(new Alert(
                        AlertType.DAILY_CHANGE,
                        Math.abs(delta) >= DAILY_CHANGE_WARNING ? Severity.WARNING : Severity.INFO,
                        String.format(Locale.ROOT, "総合スコアが前日比 %+.1f 変化（%s傾向への変化）", delta, direction)
                ));
            }
        }

        if (history.size() > window) {
            int n = history.size();
            double ma = averageTotal(n - window, n);
            double prevMa = averageTotal(n - window - 1, n - 1);
            if (ma >= 0 && prevMa < 0) {
                alerts.add(new Alert(
                        AlertType.MA_REVERSAL,
                        Severity.INFO,
                        window + "日移動平均がプラス圏に転換（市場センチメント改善の可能性）"
                ));
            } else if (ma < 0 && prevMa >= 0) {
                alerts.add(new Alert(
                        AlertType.MA_REVERSAL,
                        Severity.WARNING,
                        window + "日移動平均がマイナス圏に転換（市場センチメント悪化の可能性）"
                ));
            }
        }

        double gap = cur.domesticForeignGap;
        if (Math.abs(gap) >= DOMESTIC_FOREIGN_GAP_THRESHOLD) {
            if (gap > 0) {
                alerts.add(new Alert(
                        AlertType.DOMESTIC_FOREIGN_GAP,
                        Severity.INFO,
                        String.format(Locale.ROOT, "国内スコアが海外より %+.1f 高い（国内市場が海外より楽観的）", gap)
                ));
            } else {
                alerts.add(new Alert(
                        AlertType.DOMESTIC_FOREIGN_GAP,
                        Severity.WARNING,
                        String.format(Locale.ROOT, "国内スコアが海外より %.1f 低い（国内市場が海外より悲観的）", gap)
                ));
            }
        }
        return alerts;
    }

    public OptionalDouble movingAverage(int size) {
        if (size <= 0 || history.size() < size) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(averageTotal(history.size() - size, history.size()));
    }

    private double averageTotal(int fromInclusive, int toExclusive) {
        double sum = 0.0;
        for (int i = fromInclusive; i < toExclusive; i++) {
            sum += history.get(i).totalScore;
        }
        return sum / (toExclusive - fromInclusive);
    }
}
