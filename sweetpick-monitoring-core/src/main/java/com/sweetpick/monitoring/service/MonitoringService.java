package com.sweetpick.monitoring.service;

import com.sweetpick.monitoring.alerting.AlertEngine;
import com.sweetpick.monitoring.alerting.AlertEvaluation;
import com.sweetpick.monitoring.alerting.AlertRule;
import com.sweetpick.monitoring.logging.LogEntry;
import com.sweetpick.monitoring.logging.LogLevel;
import com.sweetpick.monitoring.logging.StructuredLogger;
import com.sweetpick.monitoring.metrics.MetricsRegistry;
import com.sweetpick.monitoring.tracing.SpanScope;
import com.sweetpick.monitoring.tracing.TracingEngine;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point the application records into and operators read from.
 *
 * <p>Composes a {@link MetricsRegistry}, a {@link TracingEngine}, a {@link StructuredLogger} and an {@link AlertEngine}
 * behind domain-shaped recording helpers, registers the default alert rules, and runs the periodic alert evaluation
 * on a single daemon thread between {@link #start()} and {@link #close()}.
 *
 * <p>Construct one instance at process start and inject it into collaborators. Recording helpers never throw.
 */
@Slf4j
public class MonitoringService implements AutoCloseable {

    /** Alert history entries included in {@link #getMonitoringData()}. */
    public static final int DATA_ALERT_HISTORY_LIMIT = 50;

    /** Log entries included in {@link #getMonitoringData()}. */
    public static final int DATA_RECENT_LOG_LIMIT = 100;

    private static final String EVALUATOR_THREAD = "sweetpick-alert-evaluator";

    private final MetricsRegistry metrics;
    private final TracingEngine tracing;
    private final StructuredLogger logger;
    private final AlertEngine alerts;
    private final Clock clock;
    private final Duration evaluationInterval;
    private final Instant startTime;

    private final AtomicLong metricsRecorded = new AtomicLong();
    private final AtomicLong tracesCreated = new AtomicLong();
    private final AtomicLong alertsTriggered = new AtomicLong();

    private final Object loopLock = new Object();
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> loop;

    /** Builds all four components from {@code settings}. */
    public MonitoringService(MonitoringSettings settings, Clock clock) {
        this(components(settings, clock), settings, clock);
    }

    public MonitoringService(
            MetricsRegistry metrics,
            TracingEngine tracing,
            StructuredLogger logger,
            AlertEngine alerts,
            MonitoringSettings settings,
            Clock clock) {
        this(new Components(metrics, tracing, logger, alerts), settings, clock);
    }

    private MonitoringService(Components components, MonitoringSettings settings, Clock clock) {
        Objects.requireNonNull(settings, "settings").validate();
        this.metrics = Objects.requireNonNull(components.metrics(), "metrics");
        this.tracing = Objects.requireNonNull(components.tracing(), "tracing");
        this.logger = Objects.requireNonNull(components.logger(), "logger");
        this.alerts = Objects.requireNonNull(components.alerts(), "alerts");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.evaluationInterval = settings.getEvaluationInterval();
        this.startTime = clock.instant();

        if (settings.isDefaultRulesEnabled()) {
            DefaultAlertRules.rules().forEach(alerts::addRule);
        }
        settings.getAdditionalRules().forEach(alerts::addRule);
        alerts.validateRules(MetricNames.ALERTABLE);
        log.info(
                "Monitoring initialized rules={} evaluationInterval={} enforceDuration={}",
                alerts.getRules().size(),
                evaluationInterval,
                alerts.isEnforceDuration());
    }

    /* --------------------- recording helpers --------------------- */

    public void recordQueryMetrics(String queryType, double responseTime, boolean success, int resultCount) {
        Map<String, String> labels = labels(MetricNames.LABEL_QUERY_TYPE, queryType);
        guarded("query metrics", () -> {
            boolean accepted = metrics.recordHistogram(MetricNames.QUERY_RESPONSE_TIME, responseTime, labels);
            metrics.incrementCounter(MetricNames.QUERY_TOTAL, 1, labels);
            metrics.incrementCounter(success ? MetricNames.QUERY_SUCCESS : MetricNames.QUERY_FAILURE, 1, labels);
            if (resultCount > 0) {
                metrics.recordHistogram(MetricNames.QUERY_RESULT_COUNT, resultCount, labels);
            }
            // read-then-write across two counters; concurrent increments may leave the gauge briefly stale
            long total = metrics.counterValue(MetricNames.QUERY_TOTAL, labels);
            long failed = metrics.counterValue(MetricNames.QUERY_FAILURE, labels);
            if (total > 0) {
                metrics.setGauge(MetricNames.ERROR_RATE, (double) failed / total, labels);
            }
            return accepted;
        });
    }

    public void recordVectorSearchMetrics(String searchType, double latency, int resultCount, boolean cacheHit) {
        Map<String, String> labels = labels(MetricNames.LABEL_SEARCH_TYPE, searchType);
        guarded("vector search metrics", () -> {
            boolean accepted = metrics.recordHistogram(MetricNames.VECTOR_SEARCH_LATENCY, latency, labels);
            metrics.recordHistogram(MetricNames.VECTOR_SEARCH_RESULTS, resultCount, labels);
            metrics.incrementCounter(MetricNames.VECTOR_SEARCH_TOTAL, 1, labels);
            metrics.incrementCounter(
                    cacheHit ? MetricNames.VECTOR_SEARCH_CACHE_HIT : MetricNames.VECTOR_SEARCH_CACHE_MISS, 1, labels);
            long total = metrics.counterValue(MetricNames.VECTOR_SEARCH_TOTAL, labels);
            long hits = metrics.counterValue(MetricNames.VECTOR_SEARCH_CACHE_HIT, labels);
            if (total > 0) {
                metrics.setGauge(MetricNames.CACHE_HIT_RATE, (double) hits / total, labels);
            }
            return accepted;
        });
    }

    public void recordSystemMetrics(double memoryUsage, double cpuUsage, int activeConnections) {
        guarded("system metrics", () -> {
            boolean memory = metrics.setGauge(MetricNames.MEMORY_USAGE, memoryUsage, null);
            boolean cpu = metrics.setGauge(MetricNames.CPU_USAGE, cpuUsage, null);
            boolean connections = metrics.setGauge(MetricNames.ACTIVE_CONNECTIONS, activeConnections, null);
            return memory && cpu && connections;
        });
    }

    public void recordBusinessMetrics(int recommendationsGenerated, Double userSatisfaction) {
        guarded("business metrics", () -> {
            boolean accepted =
                    metrics.incrementCounter(MetricNames.RECOMMENDATIONS_GENERATED, recommendationsGenerated, null);
            if (userSatisfaction != null) {
                accepted &= metrics.recordHistogram(MetricNames.USER_SATISFACTION, userSatisfaction, null);
            }
            return accepted;
        });
    }

    /* --------------------- tracing --------------------- */

    /**
     * Opens a span; close it with try-with-resources. Blank {@code traceId} starts a new trace.
     *
     * <p>The scope cannot see an exception thrown inside the block; call {@link SpanScope#markError} or use
     * {@link #traced} to record failure status.
     */
    public SpanScope traceOperation(String operationName, String traceId, String parentSpanId) {
        SpanScope scope = tracing.beginSpan(operationName, traceId, parentSpanId);
        tracesCreated.incrementAndGet();
        return scope;
    }

    public SpanScope traceOperation(String operationName) {
        return traceOperation(operationName, null, null);
    }

    /** Runs {@code work} inside a span, marking it OK or ERROR. The span is archived on every exit path. */
    public <T, E extends Exception> T traced(
            String operationName, String traceId, String parentSpanId, TracedWork<T, E> work) throws E {
        try (SpanScope span = traceOperation(operationName, traceId, parentSpanId)) {
            try {
                T result = work.run(span);
                span.markOk();
                return result;
            } catch (Throwable t) {
                span.markError(t);
                throw t;
            }
        }
    }

    @FunctionalInterface
    public interface TracedWork<T, E extends Exception> {
        T run(SpanScope span) throws E;
    }

    /* --------------------- logging --------------------- */

    public LogEntry logStructured(
            String level, String message, String correlationId, Map<String, ?> extraData, String traceId) {
        return logger.log(level, message, correlationId, extraData, traceId);
    }

    public LogEntry logStructured(LogLevel level, String message) {
        return logger.log(level, message);
    }

    /* --------------------- alert loop --------------------- */

    public void addAlertRule(AlertRule rule) {
        alerts.addRule(rule);
    }

    /** Starts the evaluation loop. Calling it again while running does nothing. */
    public void start() {
        synchronized (loopLock) {
            if (loop != null) return;
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, EVALUATOR_THREAD);
                t.setDaemon(true);
                return t;
            });
            long periodMillis = evaluationInterval.toMillis();
            loop = scheduler.scheduleWithFixedDelay(
                    this::evaluateOnce, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
            log.info("Alert evaluation loop started interval={}", evaluationInterval);
        }
    }

    public boolean isRunning() {
        synchronized (loopLock) {
            return loop != null && !loop.isDone();
        }
    }

    /**
     * One evaluation tick: snapshot the registry, evaluate every rule, fold the outcome into the statistics. Any
     * failure is logged and returned, never thrown, so the loop keeps its schedule.
     */
    public EvaluationResult evaluateOnce() {
        Instant started = clock.instant();
        try {
            AlertEvaluation evaluation = alerts.evaluateAll(metrics.snapshot());
            alertsTriggered.addAndGet(evaluation.triggered().size());
            EvaluationResult result =
                    EvaluationResult.success(started, Duration.between(started, clock.instant()), evaluation);
            if (log.isDebugEnabled()) {
                log.debug(
                        "Alert evaluation evaluated={} skipped={} triggered={} resolved={} active={}",
                        evaluation.evaluated(),
                        evaluation.skipped(),
                        evaluation.triggered().size(),
                        evaluation.resolved().size(),
                        alerts.getActiveAlerts().size());
            }
            return result;
        } catch (Throwable t) {
            log.error("Error in monitoring loop", t);
            return EvaluationResult.failure(started, Duration.between(started, clock.instant()), t);
        }
    }

    /** Cancels the evaluation loop. State stays readable. */
    @Override
    public void close() {
        synchronized (loopLock) {
            if (scheduler == null) return;
            loop.cancel(false);
            scheduler.shutdownNow();
            loop = null;
            scheduler = null;
            log.info("Alert evaluation loop stopped");
        }
    }

    /* --------------------- inspection --------------------- */

    public MonitoringData getMonitoringData() {
        return new MonitoringData(
                metrics.snapshot(),
                alerts.getActiveAlerts(),
                alerts.getAlertHistory(DATA_ALERT_HISTORY_LIMIT),
                logger.getRecentLogs(DATA_RECENT_LOG_LIMIT),
                tracing.getActiveSpans(),
                statistics(),
                Duration.between(startTime, clock.instant()));
    }

    public MonitoringStatistics statistics() {
        return new MonitoringStatistics(
                metricsRecorded.get(), tracesCreated.get(), alertsTriggered.get(), startTime);
    }

    public MetricsRegistry metrics() {
        return metrics;
    }

    public TracingEngine tracing() {
        return tracing;
    }

    public StructuredLogger logger() {
        return logger;
    }

    public AlertEngine alerts() {
        return alerts;
    }

    /* --------------------- internals --------------------- */

    /** Runs a recording helper. It counts towards {@code metrics_recorded} only if all its values were kept. */
    private void guarded(String what, BooleanSupplier recording) {
        try {
            if (recording.getAsBoolean()) {
                metricsRecorded.incrementAndGet();
            } else {
                log.debug("Recording of {} dropped invalid values", what);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to record {}", what, e);
        }
    }

    private static Map<String, String> labels(String key, String value) {
        return value == null ? Map.of() : Map.of(key, value);
    }

    private static Components components(MonitoringSettings settings, Clock clock) {
        Objects.requireNonNull(settings, "settings");
        MetricsRegistry metrics = new MetricsRegistry(clock, settings.getSeriesCapacity());
        StructuredLogger logger =
                new StructuredLogger(clock, settings.getLogCapacity(), settings.getCorrelationCapacity());
        return new Components(
                metrics,
                new TracingEngine(clock, settings.getTraceCapacity()),
                logger,
                new AlertEngine(
                        metrics, logger, clock, settings.getAlertHistoryCapacity(), settings.isEnforceDuration()));
    }

    private record Components(
            MetricsRegistry metrics, TracingEngine tracing, StructuredLogger logger, AlertEngine alerts) {}
}
