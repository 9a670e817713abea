package com.marketobserver.model;

import java.util.Map;

public final class ScoredItem {
    public final ClassifiedItem classified;
    public final int impactScore;
    public final String reason;

    public ScoredItem(ClassifiedItem classified, int impactScore, String reason) {
        if (classified == null) {
            throw new IllegalArgumentException("classified item must not be null");
        }
        this.classified = classified;
        this.impactScore = impactScore;
        this.reason = reason == null ? "" : reason;
    }

    public String text() {
        return classified.text();
    }

    public Origin origin() {
        return classified.origin();
    }

    public Category category() {
        return classified.category();
    }

    public String subCategory() {
        return classified.subCategory();
    }

    public Map<String, Object> metadata() {
        return classified.metadata();
    }
}
