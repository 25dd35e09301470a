package com.sweetpick.monitoring.logging;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum LogLevel {
    DEBUG("debug"),
    INFO("info"),
    WARNING("warning"),
    ERROR("error");

    private final String label;

    LogLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Lenient parse: {@code warn} is accepted for WARNING; null or unknown names fall back to DEBUG. */
    public static LogLevel parse(String value) {
        if (value == null) return DEBUG;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "error" -> ERROR;
            case "warning", "warn" -> WARNING;
            case "info" -> INFO;
            default -> DEBUG;
        };
    }
}
