package com.sweetpick.monitoring.alerting;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AlertStatus {
    ACTIVE,
    RESOLVED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
