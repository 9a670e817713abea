package com.marketobserver.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Captures a single observation run's step timings and item counts.
 */
public final class RunTelemetry {
    public static final String STEP_CLASSIFY = "CLASSIFY";
    public static final String STEP_SCORE = "SCORE";
    public static final String STEP_AGGREGATE = "AGGREGATE";
    public static final String STEP_EVENTS = "EVENTS";
    public static final String STEP_ALERT = "ALERT";
    public static final String STEP_HISTORY = "HISTORY";
    public static final String STEP_TRIGGER = "TRIGGER";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String trigger;
    private final Instant startedAt;
    private Instant finishedAt;
    private int itemsSubmitted;
    private int itemsScored;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Long> stepStartsNanos = new LinkedHashMap<>();

    public RunTelemetry(String trigger, Instant startedAt) {
        this.trigger = blankTo(trigger, "manual");
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    public String trigger() {
        return trigger;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.put(key, System.nanoTime());
    }

    public void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        Long startedNanos = stepStartsNanos.remove(key);
        long elapsedMs = startedNanos == null
                ? 0L
                : Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        stat.elapsedMs += elapsedMs;
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        if (errorCount > 0L) {
            errorsTotal += (int) errorCount;
        }
    }

    public void setItemCounts(int submitted, int scored) {
        this.itemsSubmitted = Math.max(0, submitted);
        this.itemsScored = Math.max(0, scored);
    }

    public void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public int errorsTotal() {
        return errorsTotal;
    }

    public List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(stat.name, stat.elapsedMs, stat.itemsIn, stat.itemsOut, stat.errorCount));
        }
        return out;
    }

    public String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("trigger=").append(trigger).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("items_submitted=").append(itemsSubmitted).append('\n');
        sb.append("items_scored=").append(itemsScored).append('\n');
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s elapsed_ms=%d in=%d out=%d err=%d",
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount
            ));
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;

        private StepStat(String name) {
            this.name = name;
        }
    }

    public record StepRecord(
            String name,
            long elapsedMs,
            long itemsIn,
            long itemsOut,
            long errorCount
    ) {
    }
}
