package com.sweetpick.monitoring.metrics;

import java.time.Instant;
import java.util.Map;

/** A single recorded value. */
public record MetricPoint(Instant timestamp, double value, Map<String, String> labels) {

    public MetricPoint {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
