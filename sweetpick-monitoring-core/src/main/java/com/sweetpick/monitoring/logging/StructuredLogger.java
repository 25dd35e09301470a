package com.sweetpick.monitoring.logging;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

/**
 * Correlated log entries kept in a fixed-size ring buffer and forwarded to SLF4J.
 *
 * <p>Each entry is appended to the buffer (the oldest entry is dropped once it is full) and then logged through SLF4J
 * as {@code [correlationId] message}. For the duration of that call the correlation id, the trace id and every
 * extra-data key are placed in the {@link MDC}; prior MDC values are restored afterwards.
 *
 * <p>The correlation table maps a task id (by default the calling thread's name, see {@link #currentTaskId()}) to a
 * correlation id. It is advisory: bounded, least recently used entries are evicted, and nothing propagates it across
 * threads.
 */
@Slf4j
public class StructuredLogger {

    public static final int DEFAULT_CAPACITY = 10_000;
    public static final int DEFAULT_CORRELATION_CAPACITY = 10_000;

    static final String MDC_CORRELATION_ID = "correlationId";
    static final String MDC_TRACE_ID = "traceId";

    private final Clock clock;
    private final int capacity;
    private final Object bufferLock = new Object();
    private final Deque<LogEntry> buffer = new ArrayDeque<>();
    private final Map<String, String> correlationIds;

    public StructuredLogger(Clock clock) {
        this(clock, DEFAULT_CAPACITY, DEFAULT_CORRELATION_CAPACITY);
    }

    public StructuredLogger(Clock clock, int capacity, int correlationCapacity) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0 but was " + capacity);
        }
        if (correlationCapacity <= 0) {
            throw new IllegalArgumentException("correlationCapacity must be > 0 but was " + correlationCapacity);
        }
        this.capacity = capacity;
        this.correlationIds = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                return size() > correlationCapacity;
            }
        };
    }

    public LogEntry log(LogLevel level, String message) {
        return log(level, message, null, null, null);
    }

    public LogEntry log(String level, String message, String correlationId, Map<String, ?> extraData, String traceId) {
        return log(LogLevel.parse(level), message, correlationId, extraData, traceId);
    }

    /**
     * Records and forwards one entry. Never throws: unreadable extra data is dropped, and a failing SLF4J backend leaves
     * the buffered entry in place.
     */
    public LogEntry log(LogLevel level, String message, String correlationId, Map<String, ?> extraData, String traceId) {
        LogEntry entry = new LogEntry(
                clock.instant(),
                level == null ? LogLevel.DEBUG : level,
                message == null ? "" : message,
                correlationId,
                traceId,
                copy(extraData),
                currentTaskId());
        synchronized (bufferLock) {
            buffer.addLast(entry);
            while (buffer.size() > capacity) {
                buffer.pollFirst();
            }
        }
        try {
            forward(entry);
        } catch (RuntimeException e) {
            log.debug("Structured log forward failed message={}", entry.message(), e);
        }
        return entry;
    }

    /** The last {@code limit} entries, oldest first. */
    public List<LogEntry> getRecentLogs(int limit) {
        if (limit <= 0) return List.of();
        synchronized (bufferLock) {
            List<LogEntry> all = new ArrayList<>(buffer);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }

    public int size() {
        synchronized (bufferLock) {
            return buffer.size();
        }
    }

    public void setCorrelationId(String taskId, String correlationId) {
        if (taskId == null) return;
        synchronized (correlationIds) {
            if (correlationId == null) correlationIds.remove(taskId);
            else correlationIds.put(taskId, correlationId);
        }
    }

    public String getCorrelationId(String taskId) {
        if (taskId == null) return null;
        synchronized (correlationIds) {
            return correlationIds.get(taskId);
        }
    }

    public void clearCorrelationId(String taskId) {
        setCorrelationId(taskId, null);
    }

    /** Identity of the ambient task, used as the default correlation-table key and recorded on every entry. */
    public static String currentTaskId() {
        return Thread.currentThread().getName();
    }

    private void forward(LogEntry entry) {
        Map<String, String> previous = new HashMap<>();
        Map<String, String> context = mdcContext(entry);
        context.forEach((k, v) -> {
            previous.put(k, MDC.get(k));
            MDC.put(k, v);
        });
        try {
            String line = "[" + entry.correlationId() + "] " + entry.message();
            switch (entry.level()) {
                case ERROR -> log.error(line);
                case WARNING -> log.warn(line);
                case INFO -> log.info(line);
                default -> log.debug(line);
            }
        } finally {
            previous.forEach(StructuredLogger::restore);
        }
    }

    private static Map<String, String> mdcContext(LogEntry entry) {
        Map<String, String> context = new LinkedHashMap<>();
        entry.extraData().forEach((k, v) -> context.put(k, String.valueOf(v)));
        if (entry.correlationId() != null) context.put(MDC_CORRELATION_ID, entry.correlationId());
        if (entry.traceId() != null) context.put(MDC_TRACE_ID, entry.traceId());
        return context;
    }

    private static void restore(String key, String prev) {
        if (prev == null) MDC.remove(key);
        else MDC.put(key, prev);
    }

    private static Map<String, Object> copy(Map<String, ?> extraData) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (extraData == null) return out;
        try {
            extraData.forEach((k, v) -> {
                if (k != null) out.put(k, v);
            });
        } catch (RuntimeException e) {
            log.debug("Extra data could not be read, logging without it", e);
            return new LinkedHashMap<>();
        }
        return out;
    }
}
