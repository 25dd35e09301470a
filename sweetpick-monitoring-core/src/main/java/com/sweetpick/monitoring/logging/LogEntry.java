package com.sweetpick.monitoring.logging;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogEntry(
        Instant timestamp,
        LogLevel level,
        String message,
        String correlationId,
        String traceId,
        Map<String, Object> extraData,
        String threadName) {

    public LogEntry {
        // extra data may hold null values, which Map.copyOf rejects
        extraData = extraData == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extraData));
    }
}
