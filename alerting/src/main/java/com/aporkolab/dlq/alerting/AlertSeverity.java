package com.aporkolab.dlq.alerting;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Alert severity, derived from how many retries a message burned before dead-lettering.
 */
public enum AlertSeverity {

    INFO("#36a64f"),
    WARNING("#ffcc00"),
    CRITICAL("#ff0000");

    private final String color;

    AlertSeverity(String color) {
        this.color = color;
    }

    /**
     * Hex color used in chat webhook attachments.
     */
    public String color() {
        return color;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    public static AlertSeverity forRetryCount(int retryCount, int warningThreshold, int criticalThreshold) {
        if (retryCount >= criticalThreshold) {
            return CRITICAL;
        }
        if (retryCount >= warningThreshold) {
            return WARNING;
        }
        return INFO;
    }
}
