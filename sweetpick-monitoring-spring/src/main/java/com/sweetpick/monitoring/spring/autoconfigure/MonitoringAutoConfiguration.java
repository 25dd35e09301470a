package com.sweetpick.monitoring.spring.autoconfigure;

import com.sweetpick.monitoring.alerting.AlertEngine;
import com.sweetpick.monitoring.logging.StructuredLogger;
import com.sweetpick.monitoring.metrics.MetricsRegistry;
import com.sweetpick.monitoring.service.MonitoringService;
import com.sweetpick.monitoring.service.MonitoringSettings;
import com.sweetpick.monitoring.tracing.TracingEngine;
import java.time.Clock;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires one {@link MonitoringService} and its components into the application context. The alert evaluation loop
 * starts with the context and stops when it closes.
 */
@AutoConfiguration
@EnableConfigurationProperties(SweetpickMonitoringProperties.class)
@ConditionalOnProperty(prefix = "sweetpick.monitoring", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MonitoringAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock monitoringClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MonitoringSettings monitoringSettings(SweetpickMonitoringProperties properties) {
        return properties.toSettings();
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsRegistry metricsRegistry(MonitoringSettings settings, Clock clock) {
        return new MetricsRegistry(clock, settings.getSeriesCapacity());
    }

    @Bean
    @ConditionalOnMissingBean
    public TracingEngine tracingEngine(MonitoringSettings settings, Clock clock) {
        return new TracingEngine(clock, settings.getTraceCapacity());
    }

    @Bean
    @ConditionalOnMissingBean
    public StructuredLogger structuredLogger(MonitoringSettings settings, Clock clock) {
        return new StructuredLogger(clock, settings.getLogCapacity(), settings.getCorrelationCapacity());
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertEngine alertEngine(
            MetricsRegistry registry, StructuredLogger structuredLogger, MonitoringSettings settings, Clock clock) {
        return new AlertEngine(
                registry, structuredLogger, clock, settings.getAlertHistoryCapacity(), settings.isEnforceDuration());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    public MonitoringService monitoringService(
            MetricsRegistry registry,
            TracingEngine tracingEngine,
            StructuredLogger structuredLogger,
            AlertEngine alertEngine,
            MonitoringSettings settings,
            Clock clock) {
        return new MonitoringService(registry, tracingEngine, structuredLogger, alertEngine, settings, clock);
    }
}
