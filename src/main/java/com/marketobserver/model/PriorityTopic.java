package com.marketobserver.model;

/**
 * Topics that form the base for reading the day: policy rates, yields, the yen and the major
 * economic releases. The dollar index is tracked but does not make a day a priority day.
 */
public enum PriorityTopic {
    FED("fed", "FRB関連", true),
    TREASURY("treasury", "米国債関連", true),
    USDJPY("usdjpy", "ドル円関連", true),
    DXY("dxy", "ドル指数関連", false),
    EMPLOYMENT("employment", "雇用関連", true),
    INFLATION("inflation", "物価関連", true),
    ISM("ism", "ISM関連", true);

    private final String wireName;
    private final String label;
    private final boolean priority;

    PriorityTopic(String wireName, String label, boolean priority) {
        this.wireName = wireName;
        this.label = label;
        this.priority = priority;
    }

    public String wireName() {
        return wireName;
    }

    public String label() {
        return label;
    }

    public boolean priority() {
        return priority;
    }
}
