package com.marketobserver.model;

public enum Category {
    MARKET("market", "市場全体"),
    SECTOR("sector", "セクター"),
    THEME("theme", "テーマ");

    private final String wireName;
    private final String displayName;

    Category(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    public String wireName() {
        return wireName;
    }

    public String displayName() {
        return displayName;
    }
}
