package com.sweetpick.monitoring.metrics;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Collection;

/** Point-in-time aggregate of one bounded series. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SeriesSummary(
        long count, double sum, double avg, double min, double max, double latest, Instant latestTimestamp) {

    /** Summarizes points in insertion order; returns null for an empty series. */
    static SeriesSummary of(Collection<MetricPoint> points) {
        if (points == null || points.isEmpty()) return null;
        long count = 0;
        double sum = 0.0d;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        MetricPoint last = null;
        for (MetricPoint p : points) {
            count++;
            sum += p.value();
            min = Math.min(min, p.value());
            max = Math.max(max, p.value());
            last = p;
        }
        return new SeriesSummary(count, sum, sum / count, min, max, last.value(), last.timestamp());
    }
}
