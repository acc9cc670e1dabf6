package com.mk.fx.qa.fanout.execution.load;

/**
 * Final figures of one implementation under one profile.
 *
 * @param throughput requests per second over the configured duration
 * @param errorRate failed requests as a percentage of all requests
 * @param duration configured duration in seconds
 */
public record LoadProfileResult(
    double throughput,
    double errorRate,
    LatencySummary latency,
    long totalRequests,
    long totalErrors,
    int duration) {}
