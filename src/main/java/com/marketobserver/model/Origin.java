package com.marketobserver.model;

import java.util.Locale;

public enum Origin {
    DOMESTIC("domestic"),
    FOREIGN("foreign");

    private final String wireName;

    Origin(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Absent, blank or unrecognised values fall back to {@link #DOMESTIC}.
     */
    public static Origin parse(String raw) {
        if (raw == null) {
            return DOMESTIC;
        }
        String text = raw.trim().toLowerCase(Locale.ROOT);
        if (FOREIGN.wireName.equals(text)) {
            return FOREIGN;
        }
        return DOMESTIC;
    }
}
