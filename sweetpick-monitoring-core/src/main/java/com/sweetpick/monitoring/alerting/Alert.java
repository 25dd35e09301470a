package com.sweetpick.monitoring.alerting;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;

/**
 * One breach of an {@link AlertRule}. Created active; resolved at most once. The same instance stays in the alert
 * history after it leaves the active set, so history readers see the resolution.
 */
@Getter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Alert {

    private final String id;
    private final String ruleName;
    private final String metric;
    private final double threshold;
    private final double currentValue;
    private final AlertSeverity severity;
    private final String message;
    private final Instant triggeredAt;
    private volatile Instant resolvedAt;
    private volatile AlertStatus status;

    Alert(AlertRule rule, double currentValue, Instant triggeredAt) {
        this.id = UUID.randomUUID().toString();
        this.ruleName = rule.name();
        this.metric = rule.metric();
        this.threshold = rule.threshold();
        this.currentValue = currentValue;
        this.severity = rule.severity();
        this.message = rule.message();
        this.triggeredAt = triggeredAt;
        this.status = AlertStatus.ACTIVE;
    }

    synchronized boolean resolve(Instant at) {
        if (status == AlertStatus.RESOLVED) return false;
        resolvedAt = at;
        status = AlertStatus.RESOLVED;
        return true;
    }

    @JsonIgnore
    public AlertKey getKey() {
        return new AlertKey(ruleName, metric);
    }

    @JsonIgnore
    public boolean isActive() {
        return status == AlertStatus.ACTIVE;
    }

    @Override
    public String toString() {
        return "Alert{" + "id=" + id + ", rule=" + ruleName + ", metric=" + metric + ", status=" + status + "}";
    }
}
