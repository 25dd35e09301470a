package com.sweetpick.monitoring.alerting;

import java.util.List;

/**
 * Outcome of one evaluation pass.
 *
 * @param evaluated rules whose metric resolved to a value
 * @param skipped rules whose metric had no value yet
 * @param triggered alerts that became active during the pass
 * @param resolved alerts that were resolved during the pass
 */
public record AlertEvaluation(int evaluated, int skipped, List<Alert> triggered, List<Alert> resolved) {

    public AlertEvaluation {
        triggered = triggered == null ? List.of() : List.copyOf(triggered);
        resolved = resolved == null ? List.of() : List.copyOf(resolved);
    }
}
