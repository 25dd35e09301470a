package com.sweetpick.monitoring.alerting;

import static org.assertj.core.api.Assertions.assertThat;

import com.sweetpick.monitoring.logging.LogEntry;
import com.sweetpick.monitoring.logging.LogLevel;
import com.sweetpick.monitoring.logging.StructuredLogger;
import com.sweetpick.monitoring.metrics.MetricsRegistry;
import com.sweetpick.monitoring.metrics.MetricsSnapshot;
import com.sweetpick.monitoring.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class AlertEngineTest {

    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    private final MetricsRegistry registry = new MetricsRegistry(clock);
    private final StructuredLogger logger = new StructuredLogger(clock);
    private final AlertEngine engine = new AlertEngine(registry, logger, clock);

    private static AlertRule errorRateRule() {
        return AlertRule.builder()
                .name("high_error_rate")
                .metric("error_rate")
                .threshold(0.05)
                .operator("gt")
                .duration(Duration.ofMinutes(5))
                .severity(AlertSeverity.CRITICAL)
                .message("Error rate is above 5%")
                .build();
    }

    @Test
    void breachTriggersAndClearResolves() {
        engine.addRule(errorRateRule());
        registry.setGauge("error_rate", 0.2, null);

        AlertEvaluation first = engine.evaluateAll();

        assertThat(first.triggered()).hasSize(1);
        assertThat(engine.getActiveAlerts()).singleElement().satisfies(alert -> {
            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
            assertThat(alert.getCurrentValue()).isEqualTo(0.2);
            assertThat(alert.getStatus()).isEqualTo(AlertStatus.ACTIVE);
            assertThat(alert.getTriggeredAt()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
        });

        clock.advance(Duration.ofMinutes(1));
        registry.setGauge("error_rate", 0.01, null);
        AlertEvaluation second = engine.evaluateAll();

        assertThat(second.resolved()).hasSize(1);
        assertThat(engine.getActiveAlerts()).isEmpty();
        assertThat(engine.getAlertHistory(10)).singleElement().satisfies(alert -> {
            assertThat(alert.getStatus()).isEqualTo(AlertStatus.RESOLVED);
            assertThat(alert.getResolvedAt()).isEqualTo(Instant.parse("2026-01-01T00:01:00Z"));
        });
    }

    @Test
    void sustainedBreachTriggersOnce() {
        engine.addRule(errorRateRule());
        registry.setGauge("error_rate", 0.3, null);

        for (int tick = 0; tick < 5; tick++) {
            engine.evaluateAll();
            clock.advance(Duration.ofMinutes(1));
        }
        Alert active = engine.getActiveAlerts().get(0);

        assertThat(engine.getAlertHistory(100)).hasSize(1);
        assertThat(active.getTriggeredAt()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));

        registry.setGauge("error_rate", 0.0, null);
        AlertEvaluation cleared = engine.evaluateAll();
        AlertEvaluation quiet = engine.evaluateAll();

        assertThat(cleared.resolved()).hasSize(1);
        assertThat(quiet.resolved()).isEmpty();
        assertThat(engine.getAlertHistory(100))
                .filteredOn(a -> a.getStatus() == AlertStatus.RESOLVED)
                .hasSize(1);
    }

    @Test
    void reBreachAfterResolutionCreatesNewAlert() {
        engine.addRule(errorRateRule());
        registry.setGauge("error_rate", 0.2, null);
        engine.evaluateAll();
        registry.setGauge("error_rate", 0.0, null);
        engine.evaluateAll();
        registry.setGauge("error_rate", 0.4, null);
        engine.evaluateAll();

        List<Alert> history = engine.getAlertHistory(10);
        assertThat(history).hasSize(2);
        assertThat(history.get(0).getId()).isNotEqualTo(history.get(1).getId());
        assertThat(history.get(1).getStatus()).isEqualTo(AlertStatus.ACTIVE);
    }

    @Test
    void transitionsEmitWarningLogLines() {
        engine.addRule(errorRateRule());
        registry.setGauge("error_rate", 0.2, null);
        engine.evaluateAll();
        registry.setGauge("error_rate", 0.0, null);
        engine.evaluateAll();

        List<LogEntry> logs = logger.getRecentLogs(10);
        assertThat(logs).hasSize(2);
        assertThat(logs).allSatisfy(entry -> {
            assertThat(entry.level()).isEqualTo(LogLevel.WARNING);
            assertThat(entry.extraData())
                    .containsKeys("alert_id", "severity", "metric", "current_value", "threshold");
        });
        assertThat(logs.get(0).message()).startsWith("Alert triggered: high_error_rate");
        assertThat(logs.get(1).message()).startsWith("Alert resolved: high_error_rate");
        assertThat(logs.get(0).extraData()).containsEntry("severity", "critical").containsEntry("current_value", 0.2);
    }

    @Test
    void unresolvedMetricIsSkipped() {
        engine.addRule(errorRateRule());

        AlertEvaluation evaluation = engine.evaluateAll();

        assertThat(evaluation.skipped()).isEqualTo(1);
        assertThat(evaluation.evaluated()).isZero();
        assertThat(engine.getActiveAlerts()).isEmpty();
    }

    @Test
    void unknownOperatorNeverBreaches() {
        engine.addRule(AlertRule.builder()
                .name("weird")
                .metric("memory_usage")
                .threshold(0.0)
                .operator("between")
                .build());
        registry.setGauge("memory_usage", 0.99, null);

        AlertEvaluation evaluation = engine.evaluateAll();

        assertThat(evaluation.evaluated()).isEqualTo(1);
        assertThat(evaluation.triggered()).isEmpty();
    }

    @Test
    void operatorsCompareValueAgainstThreshold() {
        assertThat(AlertOperator.evaluate("gt", 2.0, 1.0)).isTrue();
        assertThat(AlertOperator.evaluate("lt", 2.0, 1.0)).isFalse();
        assertThat(AlertOperator.evaluate("eq", 1.0, 1.0)).isTrue();
        assertThat(AlertOperator.evaluate("GTE", 1.0, 1.0)).isTrue();
        assertThat(AlertOperator.evaluate("lte", 0.5, 1.0)).isTrue();
        assertThat(AlertOperator.evaluate(null, 0.5, 1.0)).isFalse();
    }

    @Test
    void seriesValueTakesPrecedenceOverGaugeAndHistogram() {
        AlertRule rule = AlertRule.builder().name("slow").metric("latency").threshold(2.0).operator("gt").build();
        registry.recordHistogram("latency", 10.0, null);
        registry.setGauge("latency", 5.0, null);
        registry.recordMetric("latency", 1.0, null);

        assertThat(AlertEngine.resolveMetricValue(rule, registry.snapshot())).hasValue(1.0);

        MetricsRegistry gaugeAndHistogram = new MetricsRegistry(clock);
        gaugeAndHistogram.recordHistogram("latency", 10.0, null);
        gaugeAndHistogram.setGauge("latency", 5.0, null);
        assertThat(AlertEngine.resolveMetricValue(rule, gaugeAndHistogram.snapshot())).hasValue(5.0);

        MetricsRegistry histogramOnly = new MetricsRegistry(clock);
        histogramOnly.recordHistogram("latency", 3.0, Map.of("query_type", "dish"));
        histogramOnly.recordHistogram("latency", 10.0, Map.of("query_type", "restaurant"));
        assertThat(AlertEngine.resolveMetricValue(rule, histogramOnly.snapshot())).hasValue(10.0);
    }

    @Test
    void labeledGaugeIsResolvedByBareName() {
        engine.addRule(errorRateRule());
        registry.setGauge("error_rate", 0.2, Map.of("query_type", "dish"));

        engine.evaluateAll();

        assertThat(engine.getActiveAlerts()).hasSize(1);
    }

    @Test
    void healthyLabelDoesNotMaskBreachingLabel() {
        engine.addRule(errorRateRule());
        registry.setGauge("error_rate", 0.2, Map.of("query_type", "dish"));
        clock.advance(Duration.ofSeconds(1));
        registry.setGauge("error_rate", 0.0, Map.of("query_type", "restaurant"));

        engine.evaluateAll();

        assertThat(engine.getActiveAlerts()).singleElement().satisfies(alert -> assertThat(alert.getCurrentValue())
                .isEqualTo(0.2));
    }

    @Test
    void alertStaysActiveWhileAnyLabelBreaches() {
        engine.addRule(errorRateRule());
        registry.setGauge("error_rate", 0.33, Map.of("query_type", "dish"));
        engine.evaluateAll();

        registry.setGauge("error_rate", 0.0, Map.of("query_type", "restaurant"));
        AlertEvaluation afterHealthyWrite = engine.evaluateAll();

        assertThat(afterHealthyWrite.resolved()).isEmpty();
        assertThat(engine.getActiveAlerts()).hasSize(1);

        registry.setGauge("error_rate", 0.01, Map.of("query_type", "dish"));
        assertThat(engine.evaluateAll().resolved()).hasSize(1);
        assertThat(engine.getAlertHistory(10)).singleElement().satisfies(alert -> assertThat(alert.getStatus())
                .isEqualTo(AlertStatus.RESOLVED));
    }

    @Test
    void lowerBoundRuleTakesLowestLabeledGauge() {
        AlertRule lowHitRate = AlertRule.builder()
                .name("low_cache_hit_rate")
                .metric("cache_hit_rate")
                .threshold(0.7)
                .operator("lt")
                .build();
        registry.setGauge("cache_hit_rate", 0.4, Map.of("search_type", "keyword"));
        clock.advance(Duration.ofSeconds(1));
        registry.setGauge("cache_hit_rate", 0.95, Map.of("search_type", "semantic"));

        assertThat(AlertEngine.resolveMetricValue(lowHitRate, registry.snapshot())).hasValue(0.4);
    }

    @Test
    void durationGatingWaitsForSustainedBreach() {
        AlertEngine gated = new AlertEngine(registry, logger, clock, 100, true);
        gated.addRule(errorRateRule());
        registry.setGauge("error_rate", 0.2, null);

        assertThat(gated.evaluateAll().triggered()).isEmpty();
        clock.advance(Duration.ofMinutes(4));
        assertThat(gated.evaluateAll().triggered()).isEmpty();
        clock.advance(Duration.ofMinutes(1));
        assertThat(gated.evaluateAll().triggered()).hasSize(1);
        assertThat(gated.getActiveAlerts().get(0).getTriggeredAt())
                .isEqualTo(Instant.parse("2026-01-01T00:05:00Z"));
    }

    @Test
    void durationGatingResetsWhenBreachClears() {
        AlertEngine gated = new AlertEngine(registry, logger, clock, 100, true);
        gated.addRule(errorRateRule());

        registry.setGauge("error_rate", 0.2, null);
        gated.evaluateAll();
        clock.advance(Duration.ofMinutes(3));
        registry.setGauge("error_rate", 0.0, null);
        gated.evaluateAll();
        clock.advance(Duration.ofMinutes(1));
        registry.setGauge("error_rate", 0.2, null);
        gated.evaluateAll();
        clock.advance(Duration.ofMinutes(3));

        assertThat(gated.evaluateAll().triggered()).isEmpty();
        clock.advance(Duration.ofMinutes(2));
        assertThat(gated.evaluateAll().triggered()).hasSize(1);
    }

    @Test
    void historyIsCapacityBounded() {
        AlertEngine small = new AlertEngine(registry, logger, clock, 3, false);
        small.addRule(errorRateRule());
        for (int i = 0; i < 5; i++) {
            registry.setGauge("error_rate", 0.5, null);
            small.evaluateAll();
            registry.setGauge("error_rate", 0.0, null);
            small.evaluateAll();
        }

        assertThat(small.getAlertHistory(100)).hasSize(3);
    }

    @Test
    void validateRulesReportsMetricsNoRecorderProduces() {
        engine.addRule(errorRateRule());
        engine.addRule(AlertRule.builder()
                .name("typo")
                .metric("eror_rate")
                .threshold(1)
                .operator("gt")
                .build());

        List<AlertRule> unknown = engine.validateRules(Set.of("error_rate"));

        assertThat(unknown).extracting(AlertRule::name).containsExactly("typo");
    }

    @Test
    void nullSnapshotEvaluatesNothing() {
        engine.addRule(errorRateRule());

        AlertEvaluation evaluation = engine.evaluateAll((MetricsSnapshot) null);

        assertThat(evaluation.skipped()).isEqualTo(1);
    }
}
