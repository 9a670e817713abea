package com.marketobserver.model;

import java.util.Map;

public final class ClassifiedItem {
    public final NewsItem item;
    public final Classification classification;

    public ClassifiedItem(NewsItem item, Classification classification) {
        if (item == null) {
            throw new IllegalArgumentException("item must not be null");
        }
        this.item = item;
        this.classification = classification == null ? Classification.market() : classification;
    }

    public String text() {
        return item.text;
    }

    public Origin origin() {
        return item.origin;
    }

    public Map<String, Object> metadata() {
        return item.metadata;
    }

    public Category category() {
        return classification.category();
    }

    public String subCategory() {
        return classification.subCategory();
    }
}
