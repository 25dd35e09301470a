package com.sweetpick.monitoring.service;

import com.sweetpick.monitoring.alerting.AlertEngine;
import com.sweetpick.monitoring.alerting.AlertRule;
import com.sweetpick.monitoring.logging.StructuredLogger;
import com.sweetpick.monitoring.metrics.MetricsRegistry;
import com.sweetpick.monitoring.tracing.TracingEngine;
import java.time.Duration;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Capacities, loop interval and rule set for a {@link MonitoringService}. */
@Value
@Builder(toBuilder = true)
public class MonitoringSettings {

    @Builder.Default
    int seriesCapacity = MetricsRegistry.DEFAULT_SERIES_CAPACITY;

    @Builder.Default
    int logCapacity = StructuredLogger.DEFAULT_CAPACITY;

    @Builder.Default
    int correlationCapacity = StructuredLogger.DEFAULT_CORRELATION_CAPACITY;

    @Builder.Default
    int traceCapacity = TracingEngine.DEFAULT_TRACE_CAPACITY;

    @Builder.Default
    int alertHistoryCapacity = AlertEngine.DEFAULT_HISTORY_CAPACITY;

    @Builder.Default
    Duration evaluationInterval = Duration.ofSeconds(60);

    @Builder.Default
    boolean enforceDuration = false;

    @Builder.Default
    boolean defaultRulesEnabled = true;

    /** Rules registered after the defaults. */
    @Singular
    List<AlertRule> additionalRules;

    public static MonitoringSettings defaults() {
        return MonitoringSettings.builder().build();
    }

    public void validate() {
        if (evaluationInterval == null || evaluationInterval.isZero() || evaluationInterval.isNegative()) {
            throw new IllegalArgumentException("evaluationInterval must be positive but was " + evaluationInterval);
        }
    }
}
