package com.sweetpick.monitoring.logging;

import static org.assertj.core.api.Assertions.assertThat;

import com.sweetpick.monitoring.support.MutableClock;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class StructuredLoggerTest {

    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void ringBufferKeepsMostRecentEntries() {
        StructuredLogger logger = new StructuredLogger(clock, 1000, 100);
        for (int i = 0; i < 1200; i++) {
            logger.log(LogLevel.DEBUG, "entry-" + i);
        }

        List<LogEntry> recent = logger.getRecentLogs(1000);

        assertThat(logger.size()).isEqualTo(1000);
        assertThat(recent).hasSize(1000);
        assertThat(recent.get(0).message()).isEqualTo("entry-200");
        assertThat(recent.get(999).message()).isEqualTo("entry-1199");
        assertThat(recent).extracting(LogEntry::message).doesNotContain("entry-0", "entry-199");
    }

    @Test
    void recentLogsHonorsLimit() {
        StructuredLogger logger = new StructuredLogger(clock);
        logger.log(LogLevel.INFO, "one");
        logger.log(LogLevel.INFO, "two");
        logger.log(LogLevel.INFO, "three");

        assertThat(logger.getRecentLogs(2)).extracting(LogEntry::message).containsExactly("two", "three");
        assertThat(logger.getRecentLogs(10)).hasSize(3);
        assertThat(logger.getRecentLogs(0)).isEmpty();
    }

    @Test
    void entryCarriesCorrelationTraceAndExtraData() {
        StructuredLogger logger = new StructuredLogger(clock);
        Map<String, Object> extra = new HashMap<>();
        extra.put("restaurant", "Joe's Pizza");
        extra.put("dish_count", 7);
        extra.put("missing", null);

        LogEntry entry = logger.log("warn", "dish extraction slow", "req-42", extra, "4bf92f3577b34da6a3ce929d0e0e4736");

        assertThat(entry.level()).isEqualTo(LogLevel.WARNING);
        assertThat(entry.correlationId()).isEqualTo("req-42");
        assertThat(entry.traceId()).isEqualTo("4bf92f3577b34da6a3ce929d0e0e4736");
        assertThat(entry.extraData()).containsEntry("dish_count", 7).containsKey("missing");
        assertThat(entry.threadName()).isEqualTo(Thread.currentThread().getName());
        assertThat(entry.timestamp()).isEqualTo(clock.instant());
    }

    @Test
    void forwardingRestoresPriorMdc() {
        StructuredLogger logger = new StructuredLogger(clock);
        MDC.put("correlationId", "outer");

        logger.log("info", "inner", "req-1", Map.of("stage", "rerank"), "trace-1");

        assertThat(MDC.get("correlationId")).isEqualTo("outer");
        assertThat(MDC.get("traceId")).isNull();
        assertThat(MDC.get("stage")).isNull();
    }

    @Test
    void unreadableExtraDataIsDroppedInsteadOfThrown() {
        StructuredLogger logger = new StructuredLogger(clock);
        Map<String, Object> concurrentlyModified = new HashMap<>() {
            @Override
            public void forEach(BiConsumer<? super String, ? super Object> action) {
                throw new ConcurrentModificationException();
            }
        };
        concurrentlyModified.put("stage", "rerank");

        LogEntry entry = logger.log("error", "rerank failed", "req-5", concurrentlyModified, null);

        assertThat(entry.extraData()).isEmpty();
        assertThat(entry.correlationId()).isEqualTo("req-5");
        assertThat(logger.getRecentLogs(1)).containsExactly(entry);
    }

    @Test
    void correlationTableIsBoundedAndPerTask() {
        StructuredLogger logger = new StructuredLogger(clock, 10, 2);
        logger.setCorrelationId("task-a", "corr-a");
        logger.setCorrelationId("task-b", "corr-b");
        logger.getCorrelationId("task-a");
        logger.setCorrelationId("task-c", "corr-c");

        assertThat(logger.getCorrelationId("task-a")).isEqualTo("corr-a");
        assertThat(logger.getCorrelationId("task-b")).isNull();
        assertThat(logger.getCorrelationId("task-c")).isEqualTo("corr-c");

        logger.clearCorrelationId("task-a");
        assertThat(logger.getCorrelationId("task-a")).isNull();
        assertThat(logger.getCorrelationId(null)).isNull();
    }

    @Test
    void correlationIdIsRecoverableFromAnotherCallSiteOnTheSameTask() throws Exception {
        StructuredLogger logger = new StructuredLogger(clock);
        AtomicReference<String> seen = new AtomicReference<>();

        Thread worker = new Thread(
                () -> {
                    logger.setCorrelationId(StructuredLogger.currentTaskId(), "req-77");
                    seen.set(logger.getCorrelationId(StructuredLogger.currentTaskId()));
                },
                "dish-worker-1");
        worker.start();
        worker.join();

        assertThat(seen.get()).isEqualTo("req-77");
        assertThat(logger.getCorrelationId("dish-worker-1")).isEqualTo("req-77");
        assertThat(logger.getCorrelationId(StructuredLogger.currentTaskId())).isNull();
    }

    @Test
    void levelParsingIsLenient() {
        assertThat(LogLevel.parse("ERROR")).isEqualTo(LogLevel.ERROR);
        assertThat(LogLevel.parse("warning")).isEqualTo(LogLevel.WARNING);
        assertThat(LogLevel.parse(" info ")).isEqualTo(LogLevel.INFO);
        assertThat(LogLevel.parse("trace")).isEqualTo(LogLevel.DEBUG);
        assertThat(LogLevel.parse(null)).isEqualTo(LogLevel.DEBUG);
    }
}
