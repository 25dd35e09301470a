package com.sweetpick.monitoring.alerting;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Duration;
import java.util.Objects;
import lombok.Builder;

/**
 * Declarative threshold condition over one metric name.
 *
 * <p>{@code operator} is kept as written ({@code gt}, {@code lt}, {@code eq}, {@code gte}, {@code lte}); anything
 * else never breaches. {@code duration} is the sustain period, honored only when the engine enforces durations.
 */
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AlertRule(
        String name,
        String metric,
        double threshold,
        String operator,
        Duration duration,
        AlertSeverity severity,
        String message) {

    public AlertRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(metric, "metric");
        duration = duration == null || duration.isNegative() ? Duration.ZERO : duration;
        severity = severity == null ? AlertSeverity.WARNING : severity;
        message = message == null ? name : message;
    }

    public AlertKey key() {
        return new AlertKey(name, metric);
    }

    public boolean breached(double value) {
        return AlertOperator.evaluate(operator, value, threshold);
    }
}
