package com.marketobserver.model;

import java.util.Locale;

public enum Severity {
    INFO,
    WARNING;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
