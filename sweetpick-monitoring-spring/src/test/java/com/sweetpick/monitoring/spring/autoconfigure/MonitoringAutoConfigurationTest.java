package com.sweetpick.monitoring.spring.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;

import com.sweetpick.monitoring.alerting.AlertRule;
import com.sweetpick.monitoring.alerting.AlertSeverity;
import com.sweetpick.monitoring.metrics.MetricsRegistry;
import com.sweetpick.monitoring.service.MonitoringService;
import com.sweetpick.monitoring.service.MonitoringSettings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class MonitoringAutoConfigurationTest {

    private final ApplicationContextRunner runner =
            new ApplicationContextRunner().withConfiguration(AutoConfigurations.of(MonitoringAutoConfiguration.class));

    @Test
    void createsServiceWithDefaultsAndStartsLoop() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(MonitoringService.class);
            MonitoringService service = context.getBean(MonitoringService.class);
            assertThat(service.isRunning()).isTrue();
            assertThat(service.alerts().getRules()).hasSize(4);
            assertThat(service.metrics()).isSameAs(context.getBean(MetricsRegistry.class));
            assertThat(context.getBean(MonitoringSettings.class).getEvaluationInterval())
                    .isEqualTo(Duration.ofSeconds(60));
        });
    }

    @Test
    void bindsCapacitiesAndCustomRules() {
        runner.withPropertyValues(
                        "sweetpick.monitoring.series-capacity=50",
                        "sweetpick.monitoring.evaluation-interval=5s",
                        "sweetpick.monitoring.alerts.enforce-duration=true",
                        "sweetpick.monitoring.alerts.default-rules-enabled=false",
                        "sweetpick.monitoring.alerts.rules[0].name=slow_vector_search",
                        "sweetpick.monitoring.alerts.rules[0].metric=vector_search_latency",
                        "sweetpick.monitoring.alerts.rules[0].threshold=1.5",
                        "sweetpick.monitoring.alerts.rules[0].duration=2m",
                        "sweetpick.monitoring.alerts.rules[0].severity=critical")
                .run(context -> {
                    MonitoringService service = context.getBean(MonitoringService.class);
                    assertThat(service.metrics().seriesCapacity()).isEqualTo(50);
                    assertThat(service.alerts().isEnforceDuration()).isTrue();
                    assertThat(service.alerts().getRules()).singleElement().satisfies(rule -> {
                        assertThat(rule.name()).isEqualTo("slow_vector_search");
                        assertThat(rule.operator()).isEqualTo("gt");
                        assertThat(rule.threshold()).isEqualTo(1.5);
                        assertThat(rule.duration()).isEqualTo(Duration.ofMinutes(2));
                        assertThat(rule.severity()).isEqualTo(AlertSeverity.CRITICAL);
                        assertThat(rule.message()).isEqualTo("slow_vector_search");
                    });
                    assertThat(context.getBean(MonitoringSettings.class).getEvaluationInterval())
                            .isEqualTo(Duration.ofSeconds(5));
                });
    }

    @Test
    void disabledFlagCreatesNothing() {
        runner.withPropertyValues("sweetpick.monitoring.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(MonitoringService.class)
                        .doesNotHaveBean(MetricsRegistry.class));
    }

    @Test
    void usesApplicationClockWhenPresent() {
        runner.withUserConfiguration(FixedClockConfig.class).run(context -> {
            MonitoringService service = context.getBean(MonitoringService.class);
            assertThat(service.statistics().startTime()).isEqualTo(FixedClockConfig.NOW);
        });
    }

    @Test
    void closingContextStopsLoop() {
        runner.run(context -> {
            MonitoringService service = context.getBean(MonitoringService.class);
            context.close();
            assertThat(service.isRunning()).isFalse();
        });
    }

    @Test
    void invalidRuleMetricIsStillRegistered() {
        runner.withPropertyValues(
                        "sweetpick.monitoring.alerts.default-rules-enabled=false",
                        "sweetpick.monitoring.alerts.rules[0].name=typo",
                        "sweetpick.monitoring.alerts.rules[0].metric=eror_rate")
                .run(context -> assertThat(context.getBean(MonitoringService.class).alerts().getRules())
                        .extracting(AlertRule::metric)
                        .containsExactly("eror_rate"));
    }

    @Configuration
    static class FixedClockConfig {
        static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }
}
