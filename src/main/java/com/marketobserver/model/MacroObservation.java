package com.marketobserver.model;

import java.util.List;

/**
 * Items mentioning exchange rates, interest rates or economic indicators.
 * Identification only; never feeds the impact score.
 */
public final class MacroObservation {
    public final List<ScoredItem> fxItems;
    public final List<String> fxKeywords;
    public final List<ScoredItem> ratesItems;
    public final List<String> ratesKeywords;
    public final List<ScoredItem> dataItems;
    public final List<String> dataKeywords;

    public MacroObservation(
            List<ScoredItem> fxItems,
            List<String> fxKeywords,
            List<ScoredItem> ratesItems,
            List<String> ratesKeywords,
            List<ScoredItem> dataItems,
            List<String> dataKeywords
    ) {
        this.fxItems = copy(fxItems);
        this.fxKeywords = copy(fxKeywords);
        this.ratesItems = copy(ratesItems);
        this.ratesKeywords = copy(ratesKeywords);
        this.dataItems = copy(dataItems);
        this.dataKeywords = copy(dataKeywords);
    }

    public static MacroObservation empty() {
        return new MacroObservation(List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public int fxCount() {
        return fxItems.size();
    }

    public int ratesCount() {
        return ratesItems.size();
    }

    public int dataCount() {
        return dataItems.size();
    }

    public int totalCount() {
        return fxCount() + ratesCount() + dataCount();
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
