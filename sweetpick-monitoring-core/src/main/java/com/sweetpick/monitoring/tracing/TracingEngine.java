package com.sweetpick.monitoring.tracing;

import io.opentelemetry.api.trace.SpanId;
import io.opentelemetry.api.trace.TraceId;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import lombok.extern.slf4j.Slf4j;

/**
 * Span lifecycle: an active-span table for spans in flight and a bounded store of archived spans grouped by trace.
 *
 * <p>A span is registered by {@link #beginSpan}, mutated in place while active, and archived exactly once by
 * {@link #endSpan}. Tag and log calls against an unknown or already archived span id are ignored. Ids follow the W3C
 * trace-context format: 32 hex characters for trace ids, 16 for span ids.
 *
 * <p>The archive keeps at most {@code traceCapacity} traces; when a new trace id would exceed it, the trace that was
 * first archived is dropped.
 */
@Slf4j
public class TracingEngine {

    public static final int DEFAULT_TRACE_CAPACITY = 1000;

    private final Clock clock;
    private final int traceCapacity;
    private final Map<String, ActiveSpan> activeSpans = new ConcurrentHashMap<>();
    private final Object traceLock = new Object();
    private final LinkedHashMap<String, List<SpanData>> traces;

    public TracingEngine(Clock clock) {
        this(clock, DEFAULT_TRACE_CAPACITY);
    }

    public TracingEngine(Clock clock, int traceCapacity) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (traceCapacity <= 0) {
            throw new IllegalArgumentException("traceCapacity must be > 0 but was " + traceCapacity);
        }
        this.traceCapacity = traceCapacity;
        this.traces = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, List<SpanData>> eldest) {
                return size() > TracingEngine.this.traceCapacity;
            }
        };
    }

    /**
     * Starts a span and registers it as active. Blank ids are generated. The returned scope must be closed; use
     * try-with-resources.
     */
    public SpanScope beginSpan(String operationName, String traceId, String parentSpanId) {
        String resolvedTrace = isBlank(traceId) ? newTraceId() : traceId;
        String parent = isBlank(parentSpanId) ? null : parentSpanId;
        String name = isBlank(operationName) ? "unnamed" : operationName;
        ActiveSpan span = new ActiveSpan(newSpanId(), resolvedTrace, parent, name, clock.instant());
        activeSpans.put(span.spanId(), span);
        return new SpanScope(this, span);
    }

    public SpanScope beginSpan(String operationName) {
        return beginSpan(operationName, null, null);
    }

    /**
     * Archives the span behind {@code scope}. Calling it again for the same scope does nothing.
     *
     * @return the archived span, or null if it had already been ended
     */
    public SpanData endSpan(SpanScope scope) {
        if (scope == null) return null;
        ActiveSpan span = scope.span();
        if (!span.markEnded()) return null;
        activeSpans.remove(span.spanId(), span);
        SpanData finished = span.finish(clock.instant());
        synchronized (traceLock) {
            traces.computeIfAbsent(finished.traceId(), k -> new ArrayList<>()).add(finished);
        }
        if (log.isDebugEnabled()) {
            log.debug(
                    "Span archived trace={} span={} operation={} duration={}",
                    finished.traceId(),
                    finished.spanId(),
                    finished.operationName(),
                    finished.duration());
        }
        return finished;
    }

    public void addSpanTag(String spanId, String key, String value) {
        ActiveSpan span = spanId == null ? null : activeSpans.get(spanId);
        if (span != null) span.tag(key, value);
    }

    public void addSpanLog(String spanId, String message, String level) {
        ActiveSpan span = spanId == null ? null : activeSpans.get(spanId);
        if (span == null || message == null) return;
        span.log(new SpanLog(clock.instant(), message, isBlank(level) ? "info" : level));
    }

    /** Archived spans for {@code traceId} in archival order; empty if none exist yet. */
    public List<SpanData> getTrace(String traceId) {
        if (traceId == null) return List.of();
        synchronized (traceLock) {
            List<SpanData> spans = traces.get(traceId);
            return spans == null ? List.of() : List.copyOf(spans);
        }
    }

    /** Views of all spans currently in flight, keyed by span id. */
    public Map<String, SpanData> getActiveSpans() {
        Map<String, SpanData> out = new LinkedHashMap<>();
        activeSpans.forEach((id, span) -> out.put(id, span.view()));
        return Collections.unmodifiableMap(out);
    }

    public int traceCount() {
        synchronized (traceLock) {
            return traces.size();
        }
    }

    static String newTraceId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        String id;
        do {
            id = TraceId.fromLongs(random.nextLong(), random.nextLong());
        } while (!TraceId.isValid(id));
        return id;
    }

    static String newSpanId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        String id;
        do {
            id = SpanId.fromLong(random.nextLong());
        } while (!SpanId.isValid(id));
        return id;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
