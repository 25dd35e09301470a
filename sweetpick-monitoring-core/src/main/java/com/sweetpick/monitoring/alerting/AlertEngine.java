package com.sweetpick.monitoring.alerting;

import com.sweetpick.monitoring.logging.LogLevel;
import com.sweetpick.monitoring.logging.StructuredLogger;
import com.sweetpick.monitoring.metrics.MetricsRegistry;
import com.sweetpick.monitoring.metrics.MetricsSnapshot;
import com.sweetpick.monitoring.metrics.SeriesSummary;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;

/**
 * Evaluates {@link AlertRule}s against metric values and keeps the active/resolved alert lifecycle.
 *
 * <p>Each {@code (rule name, metric)} key is a level-triggered two-state machine:
 *
 * <ul>
 *   <li>breach, no active alert: create an active alert, add it to history, log "triggered";
 *   <li>breach, active alert: nothing;
 *   <li>no breach, active alert: resolve it, remove it from the active set (it stays in history), log "resolved";
 *   <li>no breach, no active alert: nothing.
 * </ul>
 *
 * <p>With {@code enforceDuration} on, a breach must persist for the rule's {@code duration} before the alert fires;
 * until then the key is pending and a clear tick discards it. With it off, the first breaching tick fires.
 *
 * <p>A rule whose metric has no value yet is skipped. Evaluation passes are serialized; reads of alert state take the
 * same lock.
 */
@Slf4j
public class AlertEngine {

    public static final int DEFAULT_HISTORY_CAPACITY = 1000;

    private final MetricsRegistry registry;
    private final StructuredLogger structuredLogger;
    private final Clock clock;
    private final int historyCapacity;
    private final boolean enforceDuration;

    private final List<AlertRule> rules = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();
    private final Map<AlertKey, Alert> active = new LinkedHashMap<>();
    private final Map<AlertKey, Instant> pending = new HashMap<>();
    private final Deque<Alert> history = new ArrayDeque<>();

    public AlertEngine(MetricsRegistry registry, StructuredLogger structuredLogger, Clock clock) {
        this(registry, structuredLogger, clock, DEFAULT_HISTORY_CAPACITY, false);
    }

    public AlertEngine(
            MetricsRegistry registry,
            StructuredLogger structuredLogger,
            Clock clock,
            int historyCapacity,
            boolean enforceDuration) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.structuredLogger = Objects.requireNonNull(structuredLogger, "structuredLogger");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (historyCapacity <= 0) {
            throw new IllegalArgumentException("historyCapacity must be > 0 but was " + historyCapacity);
        }
        this.historyCapacity = historyCapacity;
        this.enforceDuration = enforceDuration;
    }

    public void addRule(AlertRule rule) {
        if (rule == null) return;
        rules.add(rule);
        if (AlertOperator.parse(rule.operator()).isEmpty()) {
            log.warn("Alert rule {} uses unknown operator '{}' and will never fire", rule.name(), rule.operator());
        }
    }

    public List<AlertRule> getRules() {
        return List.copyOf(rules);
    }

    public boolean isEnforceDuration() {
        return enforceDuration;
    }

    /**
     * Logs a warning for every rule whose metric is not in {@code knownMetrics}. Such a rule never fires.
     *
     * @return the rules that reference unknown metrics
     */
    public List<AlertRule> validateRules(Collection<String> knownMetrics) {
        List<AlertRule> unknown = new ArrayList<>();
        for (AlertRule rule : rules) {
            if (knownMetrics == null || !knownMetrics.contains(rule.metric())) {
                unknown.add(rule);
                log.warn(
                        "Alert rule {} references metric '{}' which no recorder produces; it will never fire",
                        rule.name(),
                        rule.metric());
            }
        }
        return unknown;
    }

    /** Evaluates every rule against a fresh registry snapshot. */
    public AlertEvaluation evaluateAll() {
        return evaluateAll(registry.snapshot());
    }

    public AlertEvaluation evaluateAll(MetricsSnapshot snapshot) {
        MetricsSnapshot metrics = snapshot == null ? MetricsSnapshot.empty() : snapshot;
        List<Alert> triggered = new ArrayList<>();
        List<Alert> resolved = new ArrayList<>();
        int evaluated = 0;
        int skipped = 0;
        synchronized (lock) {
            Instant now = clock.instant();
            for (AlertRule rule : rules) {
                try {
                    OptionalDouble value = resolveMetricValue(rule, metrics);
                    if (value.isEmpty()) {
                        skipped++;
                        continue;
                    }
                    evaluated++;
                    apply(rule, value.getAsDouble(), now, triggered, resolved);
                } catch (RuntimeException e) {
                    skipped++;
                    log.warn("Alert rule {} could not be evaluated", rule.name(), e);
                }
            }
        }
        triggered.forEach(alert -> announce(alert, "triggered"));
        resolved.forEach(alert -> announce(alert, "resolved"));
        return new AlertEvaluation(evaluated, skipped, triggered, resolved);
    }

    public List<Alert> getActiveAlerts() {
        synchronized (lock) {
            return List.copyOf(active.values());
        }
    }

    /** The last {@code limit} alerts to have triggered, oldest first, resolved ones included. */
    public List<Alert> getAlertHistory(int limit) {
        if (limit <= 0) return List.of();
        synchronized (lock) {
            List<Alert> all = new ArrayList<>(history);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }

    /**
     * Current value for a rule's metric, looked up in order: the {@code recordMetric} series' latest point, the gauges,
     * the histogram series' latest point.
     *
     * <p>A metric name may have gauges under several label sets. They resolve to the value most likely to breach:
     * the highest for {@code gt}/{@code gte}, the lowest for {@code lt}/{@code lte}, a value equal to the threshold for
     * {@code eq}. One label set therefore cannot mask another's breach.
     */
    static OptionalDouble resolveMetricValue(AlertRule rule, MetricsSnapshot snapshot) {
        SeriesSummary series = snapshot.metrics().get(rule.metric());
        if (series != null) return OptionalDouble.of(series.latest());
        List<Double> gauges = snapshot.gaugeValues(rule.metric());
        if (!gauges.isEmpty()) return OptionalDouble.of(worstCase(rule, gauges));
        SeriesSummary histogram = snapshot.histograms().get(rule.metric());
        if (histogram != null) return OptionalDouble.of(histogram.latest());
        return OptionalDouble.empty();
    }

    private static double worstCase(AlertRule rule, List<Double> values) {
        AlertOperator operator = AlertOperator.parse(rule.operator()).orElse(AlertOperator.GT);
        return switch (operator) {
            case LT, LTE -> values.stream().mapToDouble(Double::doubleValue).min().getAsDouble();
            case EQ -> values.stream().filter(v -> v == rule.threshold()).findFirst().orElse(values.get(0));
            default -> values.stream().mapToDouble(Double::doubleValue).max().getAsDouble();
        };
    }

    private void apply(AlertRule rule, double value, Instant now, List<Alert> triggered, List<Alert> resolved) {
        AlertKey key = rule.key();
        Alert current = active.get(key);
        if (rule.breached(value)) {
            if (current != null) return;
            if (enforceDuration && !rule.duration().isZero()) {
                Instant firstBreach = pending.computeIfAbsent(key, k -> now);
                if (Duration.between(firstBreach, now).compareTo(rule.duration()) < 0) return;
            }
            pending.remove(key);
            Alert alert = new Alert(rule, value, now);
            active.put(key, alert);
            history.addLast(alert);
            while (history.size() > historyCapacity) {
                history.pollFirst();
            }
            triggered.add(alert);
        } else {
            pending.remove(key);
            if (current != null && current.resolve(now)) {
                active.remove(key);
                resolved.add(current);
            }
        }
    }

    private void announce(Alert alert, String action) {
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("alert_id", alert.getId());
        extra.put("severity", alert.getSeverity().label());
        extra.put("metric", alert.getMetric());
        extra.put("current_value", alert.getCurrentValue());
        extra.put("threshold", alert.getThreshold());
        structuredLogger.log(
                LogLevel.WARNING,
                "Alert " + action + ": " + alert.getRuleName() + " - " + alert.getMessage(),
                null,
                extra,
                null);
    }
}
