package com.marketobserver.analyzer;

import com.marketobserver.config.KeywordTables;
import com.marketobserver.model.MacroObservation;
import com.marketobserver.model.ScoredItem;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Finds items that talk about exchange rates, interest rates or economic data.
 * An item may land in more than one topic.
 */
public final class MacroObserver {
    private final KeywordTables tables;

    public MacroObserver(KeywordTables tables) {
        this.tables = tables == null ? KeywordTables.defaults() : tables;
    }

    public MacroObservation observe(List<ScoredItem> items) {
        if (items == null || items.isEmpty()) {
            return MacroObservation.empty();
        }
        List<ScoredItem> fxItems = new ArrayList<>();
        List<ScoredItem> ratesItems = new ArrayList<>();
        List<ScoredItem> dataItems = new ArrayList<>();
        Set<String> fxKeywords = new LinkedHashSet<>();
        Set<String> ratesKeywords = new LinkedHashSet<>();
        Set<String> dataKeywords = new LinkedHashSet<>();

        for (ScoredItem item : items) {
            String lower = item.text().toLowerCase(Locale.ROOT);
            collect(item, lower, tables.fxKeywords(), fxItems, fxKeywords);
            collect(item, lower, tables.ratesKeywords(), ratesItems, ratesKeywords);
            collect(item, lower, tables.dataKeywords(), dataItems, dataKeywords);
        }
        return new MacroObservation(
                fxItems,
                new ArrayList<>(fxKeywords),
                ratesItems,
                new ArrayList<>(ratesKeywords),
                dataItems,
                new ArrayList<>(dataKeywords)
        );
    }

    private void collect(
            ScoredItem item,
            String lower,
            List<String> keywords,
            List<ScoredItem> matchedItems,
            Set<String> matchedKeywords
    ) {
        boolean hit = false;
        for (String kw : keywords) {
            if (lower.contains(kw.toLowerCase(Locale.ROOT))) {
                matchedKeywords.add(kw);
                hit = true;
            }
        }
        if (hit) {
            matchedItems.add(item);
        }
    }
}
