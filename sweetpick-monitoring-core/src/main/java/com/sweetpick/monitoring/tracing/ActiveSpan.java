package com.sweetpick.monitoring.tracing;

import io.opentelemetry.api.trace.StatusCode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/** Mutable state of a span between begin and end. Owned by {@link TracingEngine}. */
final class ActiveSpan {

    private final String spanId;
    private final String traceId;
    private final String parentSpanId;
    private final String operationName;
    private final Instant startTime;
    private final Map<String, String> tags = new LinkedHashMap<>();
    private final List<SpanLog> logs = new ArrayList<>();
    private final AtomicBoolean ended = new AtomicBoolean(false);
    private StatusCode status = StatusCode.UNSET;
    private String statusMessage;

    ActiveSpan(String spanId, String traceId, String parentSpanId, String operationName, Instant startTime) {
        this.spanId = spanId;
        this.traceId = traceId;
        this.parentSpanId = parentSpanId;
        this.operationName = operationName;
        this.startTime = startTime;
    }

    String spanId() {
        return spanId;
    }

    String traceId() {
        return traceId;
    }

    String parentSpanId() {
        return parentSpanId;
    }

    String operationName() {
        return operationName;
    }

    synchronized void tag(String key, String value) {
        if (key == null || value == null) return;
        tags.put(key, value);
    }

    synchronized void log(SpanLog entry) {
        logs.add(entry);
    }

    /** ERROR is sticky: a later OK does not overwrite it. */
    synchronized void status(StatusCode code, String message) {
        if (code == null || status == StatusCode.ERROR) return;
        status = code;
        statusMessage = message;
    }

    /** Claims the right to archive this span; true exactly once. */
    boolean markEnded() {
        return ended.compareAndSet(false, true);
    }

    boolean isEnded() {
        return ended.get();
    }

    synchronized SpanData view() {
        return new SpanData(
                spanId, traceId, parentSpanId, operationName, startTime, null, null, tags, logs, status, statusMessage);
    }

    synchronized SpanData finish(Instant endTime) {
        Instant end = endTime.isBefore(startTime) ? startTime : endTime;
        return new SpanData(
                spanId,
                traceId,
                parentSpanId,
                operationName,
                startTime,
                end,
                Duration.between(startTime, end),
                tags,
                logs,
                status,
                statusMessage);
    }
}
