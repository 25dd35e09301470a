package com.sweetpick.monitoring.spring.autoconfigure;

import com.sweetpick.monitoring.alerting.AlertEngine;
import com.sweetpick.monitoring.alerting.AlertRule;
import com.sweetpick.monitoring.alerting.AlertSeverity;
import com.sweetpick.monitoring.logging.StructuredLogger;
import com.sweetpick.monitoring.metrics.MetricsRegistry;
import com.sweetpick.monitoring.service.MonitoringSettings;
import com.sweetpick.monitoring.tracing.TracingEngine;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the SweetPick monitoring core.
 *
 * <h3>Configuration Example:</h3>
 * <pre>{@code
 * # application.yml
 * sweetpick:
 *   monitoring:
 *     enabled: true
 *     series-capacity: 1000
 *     log-capacity: 10000
 *     evaluation-interval: 60s
 *     alerts:
 *       enforce-duration: false
 *       default-rules-enabled: true
 *       rules:
 *         - name: slow_vector_search
 *           metric: vector_search_latency
 *           operator: gt
 *           threshold: 1.5
 *           duration: 2m
 *           severity: critical
 * }</pre>
 */
@ConfigurationProperties(prefix = "sweetpick.monitoring")
public class SweetpickMonitoringProperties {

    /** Master switch. When false no monitoring beans are created. */
    private boolean enabled = true;

    /** Points kept per metric and histogram series. */
    private int seriesCapacity = MetricsRegistry.DEFAULT_SERIES_CAPACITY;

    private int logCapacity = StructuredLogger.DEFAULT_CAPACITY;

    private int correlationCapacity = StructuredLogger.DEFAULT_CORRELATION_CAPACITY;

    /** Finished traces kept in memory; the oldest trace is dropped first. */
    private int traceCapacity = TracingEngine.DEFAULT_TRACE_CAPACITY;

    private int alertHistoryCapacity = AlertEngine.DEFAULT_HISTORY_CAPACITY;

    /** Delay between alert evaluation passes. */
    private Duration evaluationInterval = Duration.ofSeconds(60);

    private final Alerts alerts = new Alerts();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getSeriesCapacity() {
        return seriesCapacity;
    }

    public void setSeriesCapacity(int seriesCapacity) {
        this.seriesCapacity = seriesCapacity;
    }

    public int getLogCapacity() {
        return logCapacity;
    }

    public void setLogCapacity(int logCapacity) {
        this.logCapacity = logCapacity;
    }

    public int getCorrelationCapacity() {
        return correlationCapacity;
    }

    public void setCorrelationCapacity(int correlationCapacity) {
        this.correlationCapacity = correlationCapacity;
    }

    public int getTraceCapacity() {
        return traceCapacity;
    }

    public void setTraceCapacity(int traceCapacity) {
        this.traceCapacity = traceCapacity;
    }

    public int getAlertHistoryCapacity() {
        return alertHistoryCapacity;
    }

    public void setAlertHistoryCapacity(int alertHistoryCapacity) {
        this.alertHistoryCapacity = alertHistoryCapacity;
    }

    public Duration getEvaluationInterval() {
        return evaluationInterval;
    }

    public void setEvaluationInterval(Duration evaluationInterval) {
        this.evaluationInterval = evaluationInterval;
    }

    public Alerts getAlerts() {
        return alerts;
    }

    /** Converts the bound properties into the settings the core consumes. */
    public MonitoringSettings toSettings() {
        MonitoringSettings.MonitoringSettingsBuilder builder = MonitoringSettings.builder()
                .seriesCapacity(seriesCapacity)
                .logCapacity(logCapacity)
                .correlationCapacity(correlationCapacity)
                .traceCapacity(traceCapacity)
                .alertHistoryCapacity(alertHistoryCapacity)
                .evaluationInterval(evaluationInterval)
                .enforceDuration(alerts.isEnforceDuration())
                .defaultRulesEnabled(alerts.isDefaultRulesEnabled());
        for (Rule rule : alerts.getRules()) {
            builder.additionalRule(rule.toAlertRule());
        }
        return builder.build();
    }

    /** Alert evaluation settings. */
    public static class Alerts {

        /**
         * When true a breach must last for the rule's duration before the alert fires. When false the first
         * breaching pass fires.
         */
        private boolean enforceDuration = false;

        /** Register the built-in response time, error rate, cache hit rate and memory rules. */
        private boolean defaultRulesEnabled = true;

        private List<Rule> rules = new ArrayList<>();

        public boolean isEnforceDuration() {
            return enforceDuration;
        }

        public void setEnforceDuration(boolean enforceDuration) {
            this.enforceDuration = enforceDuration;
        }

        public boolean isDefaultRulesEnabled() {
            return defaultRulesEnabled;
        }

        public void setDefaultRulesEnabled(boolean defaultRulesEnabled) {
            this.defaultRulesEnabled = defaultRulesEnabled;
        }

        public List<Rule> getRules() {
            return rules;
        }

        public void setRules(List<Rule> rules) {
            this.rules = rules;
        }
    }

    /** One additional alert rule. */
    public static class Rule {

        private String name;
        private String metric;
        private double threshold;

        /** One of gt, lt, eq, gte, lte. */
        private String operator = "gt";

        private Duration duration = Duration.ZERO;
        private AlertSeverity severity = AlertSeverity.WARNING;
        private String message;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getMetric() {
            return metric;
        }

        public void setMetric(String metric) {
            this.metric = metric;
        }

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public String getOperator() {
            return operator;
        }

        public void setOperator(String operator) {
            this.operator = operator;
        }

        public Duration getDuration() {
            return duration;
        }

        public void setDuration(Duration duration) {
            this.duration = duration;
        }

        public AlertSeverity getSeverity() {
            return severity;
        }

        public void setSeverity(AlertSeverity severity) {
            this.severity = severity;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }

        AlertRule toAlertRule() {
            return AlertRule.builder()
                    .name(name)
                    .metric(metric)
                    .threshold(threshold)
                    .operator(operator)
                    .duration(duration)
                    .severity(severity)
                    .message(message)
                    .build();
        }
    }
}
