package com.sweetpick.monitoring.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/**
 * Running counters of a {@link MonitoringService}.
 *
 * @param metricsRecorded recording-helper calls whose values were all kept; calls carrying a non-finite value or a
 *     negative count are dropped by the registry and not counted
 * @param tracesCreated spans opened through {@code traceOperation}
 * @param alertsTriggered alerts that became active since start
 * @param startTime when the service was constructed
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MonitoringStatistics(long metricsRecorded, long tracesCreated, long alertsTriggered, Instant startTime) {}
