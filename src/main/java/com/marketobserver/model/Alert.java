package com.marketobserver.model;

public record Alert(
        AlertType type,
        Severity severity,
        String message
) {
    public Alert {
        if (type == null) {
            throw new IllegalArgumentException("alert type must not be null");
        }
        severity = severity == null ? Severity.INFO : severity;
        message = message == null ? "" : message;
    }
}
