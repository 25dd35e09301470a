package com.sweetpick.monitoring.alerting;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
