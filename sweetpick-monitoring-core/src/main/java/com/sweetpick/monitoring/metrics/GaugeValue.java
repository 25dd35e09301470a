package com.sweetpick.monitoring.metrics;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** Last value written to a gauge and when it was written. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GaugeValue(double value, Instant updatedAt) {}
