package com.sweetpick.monitoring.tracing;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.opentelemetry.api.trace.StatusCode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of a span. Archived spans carry {@code endTime} and {@code duration}; views of spans still in flight
 * leave both null.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SpanData(
        String spanId,
        String traceId,
        String parentSpanId,
        String operationName,
        Instant startTime,
        Instant endTime,
        Duration duration,
        Map<String, String> tags,
        List<SpanLog> logs,
        StatusCode status,
        String statusMessage) {

    public SpanData {
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        logs = logs == null ? List.of() : List.copyOf(logs);
    }

    public boolean finished() {
        return endTime != null;
    }
}
