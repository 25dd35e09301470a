package com.sweetpick.monitoring.service;

import com.sweetpick.monitoring.alerting.AlertRule;
import com.sweetpick.monitoring.alerting.AlertSeverity;
import java.time.Duration;
import java.util.List;

/** Rules every {@link MonitoringService} registers at construction unless disabled. */
public final class DefaultAlertRules {

    private static final Duration SUSTAIN = Duration.ofMinutes(5);

    private DefaultAlertRules() {}

    public static List<AlertRule> rules() {
        return List.of(
                AlertRule.builder()
                        .name("high_response_time")
                        .metric(MetricNames.QUERY_RESPONSE_TIME)
                        .threshold(2.0)
                        .operator("gt")
                        .duration(SUSTAIN)
                        .severity(AlertSeverity.WARNING)
                        .message("Query response time is above 2 seconds")
                        .build(),
                AlertRule.builder()
                        .name("high_error_rate")
                        .metric(MetricNames.ERROR_RATE)
                        .threshold(0.05)
                        .operator("gt")
                        .duration(SUSTAIN)
                        .severity(AlertSeverity.CRITICAL)
                        .message("Error rate is above 5%")
                        .build(),
                AlertRule.builder()
                        .name("low_cache_hit_rate")
                        .metric(MetricNames.CACHE_HIT_RATE)
                        .threshold(0.7)
                        .operator("lt")
                        .duration(SUSTAIN)
                        .severity(AlertSeverity.WARNING)
                        .message("Cache hit rate is below 70%")
                        .build(),
                AlertRule.builder()
                        .name("high_memory_usage")
                        .metric(MetricNames.MEMORY_USAGE)
                        .threshold(0.8)
                        .operator("gt")
                        .duration(SUSTAIN)
                        .severity(AlertSeverity.WARNING)
                        .message("Memory usage is above 80%")
                        .build());
    }
}
