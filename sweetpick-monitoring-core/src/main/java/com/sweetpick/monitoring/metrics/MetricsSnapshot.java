package com.sweetpick.monitoring.metrics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Consistent view of a {@link MetricsRegistry}, taken under a single lock acquisition.
 *
 * @param metrics summaries of the series written through {@code recordMetric}, by name
 * @param counters counter values by key
 * @param gauges gauge values by key
 * @param histograms summaries of the series written through {@code recordHistogram}, by name
 */
public record MetricsSnapshot(
        Map<String, SeriesSummary> metrics,
        Map<MetricKey, Long> counters,
        Map<MetricKey, GaugeValue> gauges,
        Map<String, SeriesSummary> histograms) {

    public MetricsSnapshot {
        metrics = freeze(metrics);
        counters = freeze(counters);
        gauges = freeze(gauges);
        histograms = freeze(histograms);
    }

    public static MetricsSnapshot empty() {
        return new MetricsSnapshot(Map.of(), Map.of(), Map.of(), Map.of());
    }

    public long counter(String name, Map<String, String> labels) {
        Long value = counters.get(MetricKey.of(name, labels));
        return value == null ? 0L : value;
    }

    public OptionalDouble gauge(String name, Map<String, String> labels) {
        GaugeValue value = gauges.get(MetricKey.of(name, labels));
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value.value());
    }

    /** Values of every gauge named {@code name}, across all label sets, unlabeled included. */
    public List<Double> gaugeValues(String name) {
        List<Double> values = new ArrayList<>();
        gauges.forEach((key, gauge) -> {
            if (key.name().equals(name)) values.add(gauge.value());
        });
        return values;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return metrics.isEmpty() && counters.isEmpty() && gauges.isEmpty() && histograms.isEmpty();
    }

    private static <K, V> Map<K, V> freeze(Map<K, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
