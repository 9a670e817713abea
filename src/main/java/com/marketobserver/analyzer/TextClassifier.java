package com.marketobserver.analyzer;

import com.marketobserver.config.KeywordTables;
import com.marketobserver.model.Category;
import com.marketobserver.model.ClassifiedItem;
import com.marketobserver.model.Classification;
import com.marketobserver.model.NewsItem;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword-table classifier. Sector sets a provisional category, a theme overrides it,
 * and any market-wide keyword wins last and clears the sub-category.
 */
public final class TextClassifier implements ItemClassifier {
    private final KeywordTables tables;

    public TextClassifier(KeywordTables tables) {
        this.tables = tables == null ? KeywordTables.defaults() : tables;
    }

    public Classification classify(String text) {
        String lower = lower(text);
        Category category = Category.MARKET;
        String subCategory = null;

        String sector = firstMatchingGroup(tables.sectorGroups(), lower);
        if (sector != null) {
            category = Category.SECTOR;
            subCategory = sector;
        }

        String theme = firstMatchingGroup(tables.themeGroups(), lower);
        if (theme != null) {
            category = Category.THEME;
            subCategory = theme;
        }

        if (containsAny(lower, tables.marketKeywords())) {
            category = Category.MARKET;
            subCategory = null;
        }
        return new Classification(category, subCategory);
    }

    @Override
    public ClassifiedItem classify(NewsItem item) {
        if (item == null) {
            throw new IllegalArgumentException("item must not be null");
        }
        return new ClassifiedItem(item, classify(item.text));
    }

    private String firstMatchingGroup(Map<String, List<String>> groups, String lower) {
        for (Map.Entry<String, List<String>> group : groups.entrySet()) {
            if (containsAny(lower, group.getValue())) {
                return group.getKey();
            }
        }
        return null;
    }

    static boolean containsAny(String lower, List<String> keywords) {
        for (String kw : keywords) {
            if (lower.contains(kw.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
