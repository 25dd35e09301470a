package com.sweetpick.monitoring.tracing;

import java.time.Instant;

/** A timestamped message attached to a span while it was active. */
public record SpanLog(Instant timestamp, String message, String level) {}
