package com.sweetpick.monitoring.metrics;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory store for counters, gauges and bounded raw-value series.
 *
 * <p>Every operation, readers included, runs under one lock owned by the registry, so each call is atomic and
 * {@link #snapshot()} never observes a half-applied write. Series are capped at {@code seriesCapacity} points and
 * evict their oldest point first; writers are never blocked beyond the critical section.
 *
 * <p>Recording methods never throw. A null or blank name, or a non-finite value, is dropped; null labels count as
 * no labels.
 */
@Slf4j
public class MetricsRegistry {

    public static final int DEFAULT_SERIES_CAPACITY = 1000;

    private final Object lock = new Object();
    private final Clock clock;
    private final int seriesCapacity;

    private final Map<String, Deque<MetricPoint>> metrics = new LinkedHashMap<>();
    private final Map<String, Deque<MetricPoint>> histograms = new LinkedHashMap<>();
    private final Map<MetricKey, Long> counters = new LinkedHashMap<>();
    private final Map<MetricKey, GaugeValue> gauges = new LinkedHashMap<>();

    public MetricsRegistry(Clock clock) {
        this(clock, DEFAULT_SERIES_CAPACITY);
    }

    public MetricsRegistry(Clock clock, int seriesCapacity) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (seriesCapacity <= 0) {
            throw new IllegalArgumentException("seriesCapacity must be > 0 but was " + seriesCapacity);
        }
        this.seriesCapacity = seriesCapacity;
    }

    /** @return whether the point was stored */
    public boolean recordMetric(String name, double value, Map<String, String> labels) {
        return append(metrics, name, value, labels);
    }

    /** @return whether the point was stored */
    public boolean recordHistogram(String name, double value, Map<String, String> labels) {
        return append(histograms, name, value, labels);
    }

    public boolean incrementCounter(String name) {
        return incrementCounter(name, 1L, null);
    }

    /**
     * Adds {@code delta} to the counter, saturating at {@link Long#MAX_VALUE}.
     *
     * @return whether the delta was applied; false for a blank name or a negative delta
     */
    public boolean incrementCounter(String name, long delta, Map<String, String> labels) {
        if (isBlank(name) || delta < 0) {
            log.debug("Dropping counter increment name={} delta={}", name, delta);
            return false;
        }
        MetricKey key = MetricKey.of(name, labels);
        synchronized (lock) {
            counters.merge(key, delta, MetricsRegistry::saturatedAdd);
        }
        return true;
    }

    /** @return whether the value was stored */
    public boolean setGauge(String name, double value, Map<String, String> labels) {
        if (isBlank(name) || !Double.isFinite(value)) {
            log.debug("Dropping gauge write name={} value={}", name, value);
            return false;
        }
        MetricKey key = MetricKey.of(name, labels);
        synchronized (lock) {
            gauges.put(key, new GaugeValue(value, clock.instant()));
        }
        return true;
    }

    public long counterValue(String name, Map<String, String> labels) {
        MetricKey key = MetricKey.of(name, labels);
        synchronized (lock) {
            return counters.getOrDefault(key, 0L);
        }
    }

    public Double gaugeValue(String name, Map<String, String> labels) {
        MetricKey key = MetricKey.of(name, labels);
        synchronized (lock) {
            GaugeValue value = gauges.get(key);
            return value == null ? null : value.value();
        }
    }

    /** Copy of the {@code recordMetric} series for {@code name}, oldest first. */
    public List<MetricPoint> points(String name) {
        synchronized (lock) {
            Deque<MetricPoint> series = metrics.get(name);
            return series == null ? List.of() : List.copyOf(series);
        }
    }

    /** Copy of the {@code recordHistogram} series for {@code name}, oldest first. */
    public List<MetricPoint> histogramPoints(String name) {
        synchronized (lock) {
            Deque<MetricPoint> series = histograms.get(name);
            return series == null ? List.of() : List.copyOf(series);
        }
    }

    public int seriesCapacity() {
        return seriesCapacity;
    }

    /** Summarizes every tracked series and copies counters and gauges. Not cached: O(total buffered points). */
    public MetricsSnapshot snapshot() {
        synchronized (lock) {
            return new MetricsSnapshot(summarize(metrics), counters, gauges, summarize(histograms));
        }
    }

    private boolean append(
            Map<String, Deque<MetricPoint>> target, String name, double value, Map<String, String> labels) {
        if (isBlank(name) || !Double.isFinite(value)) {
            log.debug("Dropping series point name={} value={}", name, value);
            return false;
        }
        Map<String, String> sanitized = MetricKey.sanitize(labels);
        synchronized (lock) {
            // stamped inside the lock so series order and timestamp order agree
            MetricPoint point = new MetricPoint(clock.instant(), value, sanitized);
            Deque<MetricPoint> series = target.computeIfAbsent(name, k -> new ArrayDeque<>());
            series.addLast(point);
            while (series.size() > seriesCapacity) {
                series.pollFirst();
            }
        }
        return true;
    }

    static long saturatedAdd(long current, long delta) {
        return current > Long.MAX_VALUE - delta ? Long.MAX_VALUE : current + delta;
    }

    private static Map<String, SeriesSummary> summarize(Map<String, Deque<MetricPoint>> source) {
        Map<String, SeriesSummary> out = new LinkedHashMap<>();
        for (Map.Entry<String, Deque<MetricPoint>> e : source.entrySet()) {
            SeriesSummary summary = SeriesSummary.of(e.getValue());
            if (summary != null) out.put(e.getKey(), summary);
        }
        return out;
    }

    private static boolean isBlank(String name) {
        return name == null || name.isBlank();
    }
}
