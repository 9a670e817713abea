package com.marketobserver.runner;

import com.marketobserver.model.AggregateRecord;
import com.marketobserver.model.Alert;
import com.marketobserver.model.BatchRatios;
import com.marketobserver.model.HistoryComparison;
import com.marketobserver.model.MacroObservation;
import com.marketobserver.model.PoliticalEvent;
import com.marketobserver.model.PriorityMacro;
import com.marketobserver.model.ScoredItem;
import com.marketobserver.model.Trigger;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
public final class ObservationResult {
    public final LocalDate date;
    public final List<ScoredItem> scoredItems;
    public final AggregateRecord aggregate;
    public final BatchRatios ratios;
    public final MacroObservation macro;
    public final PriorityMacro priorityMacro;
    public final List<PoliticalEvent> politicalEvents;
    public final List<Alert> alerts;
    public final List<Trigger> triggers;
    public final HistoryComparison history;
    public final int consecutiveHighZeroDays;
    public final String summary;
    public final int submittedCount;
    public final int scoredCount;

    @Builder(toBuilder = true)
    public ObservationResult(
            LocalDate date,
            List<ScoredItem> scoredItems,
            AggregateRecord aggregate,
            BatchRatios ratios,
            MacroObservation macro,
            PriorityMacro priorityMacro,
            List<PoliticalEvent> politicalEvents,
            List<Alert> alerts,
            List<Trigger> triggers,
            HistoryComparison history,
            int consecutiveHighZeroDays,
            String summary,
            int submittedCount,
            int scoredCount
    ) {
        this.date = date;
        this.scoredItems = scoredItems == null ? List.of() : List.copyOf(scoredItems);
        this.aggregate = aggregate == null ? AggregateRecord.empty() : aggregate;
        this.ratios = ratios == null ? BatchRatios.empty() : ratios;
        this.macro = macro == null ? MacroObservation.empty() : macro;
        this.priorityMacro = priorityMacro == null ? PriorityMacro.empty() : priorityMacro;
        this.politicalEvents = politicalEvents == null ? List.of() : List.copyOf(politicalEvents);
        this.alerts = alerts == null ? List.of() : List.copyOf(alerts);
        this.triggers = triggers == null ? List.of() : List.copyOf(triggers);
        this.history = history == null ? HistoryComparison.none() : history;
        this.consecutiveHighZeroDays = Math.max(0, consecutiveHighZeroDays);
        this.summary = summary == null ? "" : summary;
        this.submittedCount = Math.max(0, submittedCount);
        this.scoredCount = Math.max(0, scoredCount);
    }

    public int skippedCount() {
        return Math.max(0, submittedCount - scoredCount);
    }
}
