package com.sweetpick.monitoring.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sweetpick.monitoring.alerting.Alert;
import com.sweetpick.monitoring.logging.LogEntry;
import com.sweetpick.monitoring.metrics.MetricsSnapshot;
import com.sweetpick.monitoring.tracing.SpanData;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/** Consolidated monitoring document returned by {@link MonitoringService#getMonitoringData()}. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MonitoringData(
        MetricsSnapshot metrics,
        List<Alert> activeAlerts,
        List<Alert> alertHistory,
        List<LogEntry> recentLogs,
        Map<String, SpanData> activeSpans,
        MonitoringStatistics statistics,
        Duration uptime) {}
