package com.sweetpick.monitoring.tracing;

import io.opentelemetry.api.trace.StatusCode;

/**
 * Handle to an active span. Closing the scope ends and archives the span, so a try-with-resources block guarantees
 * archival on every exit path:
 *
 * <pre>{@code
 * try (SpanScope span = tracing.beginSpan("vector.search", null, null)) {
 *     span.addTag("collection", "dishes");
 *     ...
 * }
 * }</pre>
 *
 * <p>Every method is safe to call after the span has ended; it then does nothing.
 */
public final class SpanScope implements AutoCloseable {

    private final TracingEngine engine;
    private final ActiveSpan span;

    SpanScope(TracingEngine engine, ActiveSpan span) {
        this.engine = engine;
        this.span = span;
    }

    public String spanId() {
        return span.spanId();
    }

    public String traceId() {
        return span.traceId();
    }

    public String parentSpanId() {
        return span.parentSpanId();
    }

    public String operationName() {
        return span.operationName();
    }

    public SpanScope addTag(String key, String value) {
        engine.addSpanTag(span.spanId(), key, value);
        return this;
    }

    public SpanScope addLog(String message) {
        return addLog(message, "info");
    }

    public SpanScope addLog(String message, String level) {
        engine.addSpanLog(span.spanId(), message, level);
        return this;
    }

    public SpanScope markOk() {
        if (!span.isEnded()) span.status(StatusCode.OK, null);
        return this;
    }

    public SpanScope markError(Throwable error) {
        if (!span.isEnded()) {
            span.status(StatusCode.ERROR, error == null ? null : error.toString());
            if (error != null) span.tag("error", error.getClass().getSimpleName());
        }
        return this;
    }

    public boolean isEnded() {
        return span.isEnded();
    }

    ActiveSpan span() {
        return span;
    }

    @Override
    public void close() {
        engine.endSpan(this);
    }
}
