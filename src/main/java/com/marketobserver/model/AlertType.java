package com.marketobserver.model;

public enum AlertType {
    DAILY_CHANGE("daily_change"),
    MA_REVERSAL("ma_reversal"),
    DOMESTIC_FOREIGN_GAP("domestic_foreign_gap");

    private final String wireName;

    AlertType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
