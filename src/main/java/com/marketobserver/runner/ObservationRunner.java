package com.marketobserver.runner;

import com.marketobserver.alert.AlertDetector;
import com.marketobserver.analyzer.Aggregator;
import com.marketobserver.analyzer.ImpactScorer;
import com.marketobserver.analyzer.ItemClassifier;
import com.marketobserver.analyzer.MacroObserver;
import com.marketobserver.analyzer.PoliticalEventDetector;
import com.marketobserver.analyzer.PriorityMacroDetector;
import com.marketobserver.analyzer.TextClassifier;
import com.marketobserver.analyzer.TriggerDetector;
import com.marketobserver.config.Config;
import com.marketobserver.config.KeywordTables;
import com.marketobserver.core.RunTelemetry;
import com.marketobserver.history.HistoryStore;
import com.marketobserver.model.AggregateRecord;
import com.marketobserver.model.Alert;
import com.marketobserver.model.BatchRatios;
import com.marketobserver.model.ClassifiedItem;
import com.marketobserver.model.HistoryComparison;
import com.marketobserver.model.MacroObservation;
import com.marketobserver.model.NewsItem;
import com.marketobserver.model.PoliticalEvent;
import com.marketobserver.model.PriorityMacro;
import com.marketobserver.model.ScoredItem;
import com.marketobserver.model.Trigger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 模块说明：ObservationRunner（class）。
 * 主要职责：串联分类、打分、汇总、告警、历史记录与观测提示，产出一次运行的完整结果。
 * 使用建议：单线程同步执行；同一进程内多次运行时 AlertDetector 会累积每次的汇总结果。
 */
public final class ObservationRunner {
    private static final Logger LOG = LogManager.getLogger(ObservationRunner.class);

    private final ItemClassifier classifier;
    private final ImpactScorer scorer;
    private final Aggregator aggregator;
    private final MacroObserver macroObserver;
    private final PriorityMacroDetector priorityDetector;
    private final PoliticalEventDetector politicalDetector;
    private final AlertDetector alertDetector;
    private final TriggerDetector triggerDetector;
    private final HistoryStore historyStore;
    private final DailySummary dailySummary;

    public ObservationRunner(
            ItemClassifier classifier,
            ImpactScorer scorer,
            Aggregator aggregator,
            MacroObserver macroObserver,
            PriorityMacroDetector priorityDetector,
            PoliticalEventDetector politicalDetector,
            AlertDetector alertDetector,
            TriggerDetector triggerDetector,
            HistoryStore historyStore,
            DailySummary dailySummary
    ) {
        if (historyStore == null) {
            throw new IllegalArgumentException("historyStore must not be null");
        }
        this.classifier = classifier;
        this.scorer = scorer;
        this.aggregator = aggregator;
        this.macroObserver = macroObserver;
        this.priorityDetector = priorityDetector;
        this.politicalDetector = politicalDetector;
        this.alertDetector = alertDetector;
        this.triggerDetector = triggerDetector;
        this.historyStore = historyStore;
        this.dailySummary = dailySummary;
    }

    /**
     * Wires the rule-based stages from configuration. Persisted days before today are
     * replayed into the alert detector so day-over-day rules see the previous run.
     */
    public static ObservationRunner create(Config config, Clock clock) {
        KeywordTables tables = KeywordTables.fromConfig(config);
        Clock zoned = clock == null ? Clock.system(config.zone()) : clock;
        HistoryStore store = new HistoryStore(config.getPath("history.path"), zoned);
        AlertDetector alerts = new AlertDetector();
        alerts.seed(store.getLastNDays(HistoryStore.RETENTION_DAYS));
        return new ObservationRunner(
                new TextClassifier(tables),
                new ImpactScorer(tables),
                new Aggregator(),
                new MacroObserver(tables),
                new PriorityMacroDetector(),
                new PoliticalEventDetector(),
                alerts,
                new TriggerDetector(),
                store,
                new DailySummary()
        );
    }

    public HistoryStore historyStore() {
        return historyStore;
    }

    public AlertDetector alertDetector() {
        return alertDetector;
    }

/**
 * 方法说明：run，负责执行一次完整观测。
 * 处理流程：单条分类/打分失败会被跳过，结果中的 scoredCount 为实际参与统计的条数。
 * 维护提示：历史写入失败以 IOException 抛出，调用方决定是否终止。
 */
    public ObservationResult run(List<NewsItem> items, RunTelemetry telemetry) throws IOException {
        RunTelemetry t = telemetry == null ? new RunTelemetry("manual", Instant.now()) : telemetry;
        int submitted = items == null ? 0 : items.size();

        t.startStep(RunTelemetry.STEP_CLASSIFY);
        List<ClassifiedItem> classified = classifier.classifyBatch(items);
        t.endStep(RunTelemetry.STEP_CLASSIFY, submitted, classified.size(), submitted - classified.size());

        t.startStep(RunTelemetry.STEP_SCORE);
        List<ScoredItem> scored = scorer.scoreBatch(classified);
        t.endStep(RunTelemetry.STEP_SCORE, classified.size(), scored.size(), classified.size() - scored.size());

        t.startStep(RunTelemetry.STEP_AGGREGATE);
        AggregateRecord aggregate = aggregator.aggregate(scored);
        MacroObservation macro = macroObserver.observe(scored);
        BatchRatios ratios = aggregator.ratios(scored, macro.totalCount());
        t.endStep(RunTelemetry.STEP_AGGREGATE, scored.size(), 1, 0);

        t.startStep(RunTelemetry.STEP_EVENTS);
        PriorityMacro priority = priorityDetector.detect(scored);
        List<PoliticalEvent> political = politicalDetector.detect(scored);
        t.endStep(RunTelemetry.STEP_EVENTS, scored.size(), priority.totalCount() + political.size(), 0);

        t.startStep(RunTelemetry.STEP_ALERT);
        List<Alert> alerts = alertDetector.detectAlerts(aggregate);
        alertDetector.addDailyScore(aggregate);
        t.endStep(RunTelemetry.STEP_ALERT, 1, alerts.size(), 0);

        t.startStep(RunTelemetry.STEP_HISTORY);
        HistoryComparison comparison = historyStore.get7DayComparison(aggregate.totalScore, ratios);
        int highZeroDays = historyStore.getConsecutiveHighZeroDays();
        if (ratios.zeroRatio() > HistoryStore.HIGH_ZERO_RATIO) {
            highZeroDays++;
        }
        historyStore.addDailyRecord(
                aggregate.totalScore,
                ratios.zeroRatio(),
                ratios.plus2Ratio(),
                ratios.minus2Ratio(),
                aggregate.newsCount,
                ratios.macroRatio()
        );
        t.endStep(RunTelemetry.STEP_HISTORY, 1, 1, 0);

        t.startStep(RunTelemetry.STEP_TRIGGER);
        List<Trigger> triggers = triggerDetector.detect(
                ratios.zeroRatio(),
                ratios.plus2Ratio(),
                ratios.minus2Ratio(),
                ratios.macroRatio(),
                highZeroDays
        );
        t.endStep(RunTelemetry.STEP_TRIGGER, 1, triggers.size(), 0);

        t.setItemCounts(submitted, scored.size());
        t.finish();
        if (scored.size() < submitted) {
            LOG.warn("observation skipped items submitted={} scored={}", submitted, scored.size());
        }
        LOG.info("observation finished total_score={} news_count={} alerts={} triggers={} priority={} political={}",
                aggregate.totalScore, aggregate.newsCount, alerts.size(), triggers.size(),
                priority.hasAny(), political.size());
        LOG.debug("telemetry\n{}", t.getSummary());

        return ObservationResult.builder()
                .date(historyStore.today())
                .scoredItems(scored)
                .aggregate(aggregate)
                .ratios(ratios)
                .macro(macro)
                .priorityMacro(priority)
                .politicalEvents(political)
                .alerts(alerts)
                .triggers(triggers)
                .history(comparison)
                .consecutiveHighZeroDays(highZeroDays)
                .summary(dailySummary.oneLiner(aggregate.totalScore, ratios.zeroRatio(), priority.hasAny()))
                .submittedCount(submitted)
                .scoredCount(scored.size())
                .build();
    }
}
