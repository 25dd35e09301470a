package com.sweetpick.monitoring.service;

import java.util.Set;

/** Metric and label names written by {@link MonitoringService}'s recording helpers. */
public final class MetricNames {

    public static final String QUERY_RESPONSE_TIME = "query_response_time";
    public static final String QUERY_RESULT_COUNT = "query_result_count";
    public static final String QUERY_TOTAL = "query_total";
    public static final String QUERY_SUCCESS = "query_success";
    public static final String QUERY_FAILURE = "query_failure";
    public static final String ERROR_RATE = "error_rate";

    public static final String VECTOR_SEARCH_LATENCY = "vector_search_latency";
    public static final String VECTOR_SEARCH_RESULTS = "vector_search_results";
    public static final String VECTOR_SEARCH_TOTAL = "vector_search_total";
    public static final String VECTOR_SEARCH_CACHE_HIT = "vector_search_cache_hit";
    public static final String VECTOR_SEARCH_CACHE_MISS = "vector_search_cache_miss";
    public static final String CACHE_HIT_RATE = "cache_hit_rate";

    public static final String MEMORY_USAGE = "memory_usage";
    public static final String CPU_USAGE = "cpu_usage";
    public static final String ACTIVE_CONNECTIONS = "active_connections";

    public static final String RECOMMENDATIONS_GENERATED = "recommendations_generated";
    public static final String USER_SATISFACTION = "user_satisfaction";

    // Labels
    public static final String LABEL_QUERY_TYPE = "query_type";
    public static final String LABEL_SEARCH_TYPE = "search_type";

    /** Names an alert rule can resolve: series, histograms and gauges. Counters are not alertable. */
    public static final Set<String> ALERTABLE = Set.of(
            QUERY_RESPONSE_TIME,
            QUERY_RESULT_COUNT,
            ERROR_RATE,
            VECTOR_SEARCH_LATENCY,
            VECTOR_SEARCH_RESULTS,
            CACHE_HIT_RATE,
            MEMORY_USAGE,
            CPU_USAGE,
            ACTIVE_CONNECTIONS,
            USER_SATISFACTION);

    private MetricNames() {}
}
