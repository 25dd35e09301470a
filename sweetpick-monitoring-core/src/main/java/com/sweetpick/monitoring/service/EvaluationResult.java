package com.sweetpick.monitoring.service;

import com.sweetpick.monitoring.alerting.AlertEvaluation;
import java.time.Duration;
import java.time.Instant;

/**
 * Result of one tick of the evaluation loop: either the pass outcome or the error that stopped it. Ticks report
 * through this value and never throw.
 */
public record EvaluationResult(Instant startedAt, Duration elapsed, AlertEvaluation evaluation, Throwable error) {

    static EvaluationResult success(Instant startedAt, Duration elapsed, AlertEvaluation evaluation) {
        return new EvaluationResult(startedAt, elapsed, evaluation, null);
    }

    static EvaluationResult failure(Instant startedAt, Duration elapsed, Throwable error) {
        return new EvaluationResult(startedAt, elapsed, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
