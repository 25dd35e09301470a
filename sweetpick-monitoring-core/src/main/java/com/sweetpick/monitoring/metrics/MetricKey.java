package com.sweetpick.monitoring.metrics;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Identity of a counter or gauge: the metric name plus its labels, sorted by label name.
 *
 * <p>Two keys built from the same labels in a different insertion order are equal. {@link #toString()} renders the
 * Prometheus-style {@code name{k=v,...}} form for display; it is never parsed back.
 */
public record MetricKey(String name, SortedMap<String, String> labels) {

    public MetricKey {
        labels = Collections.unmodifiableSortedMap(new TreeMap<>(labels == null ? Map.of() : labels));
    }

    /** Builds a key, dropping label entries whose name or value is null. */
    public static MetricKey of(String name, Map<String, String> labels) {
        return new MetricKey(name, sanitize(labels));
    }

    public static MetricKey of(String name) {
        return new MetricKey(name, null);
    }

    public boolean unlabeled() {
        return labels.isEmpty();
    }

    static SortedMap<String, String> sanitize(Map<String, String> labels) {
        SortedMap<String, String> sorted = new TreeMap<>();
        if (labels == null) return sorted;
        try {
            labels.forEach((k, v) -> {
                if (k != null && v != null) sorted.put(k, v);
            });
        } catch (RuntimeException ignore) {
            // a label map that cannot be iterated counts as no labels
            sorted.clear();
        }
        return sorted;
    }

    @Override
    public String toString() {
        if (labels.isEmpty()) return name;
        return labels.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(",", name + "{", "}"));
    }
}
