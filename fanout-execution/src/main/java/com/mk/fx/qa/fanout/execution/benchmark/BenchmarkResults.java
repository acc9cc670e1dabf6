package com.mk.fx.qa.fanout.execution.benchmark;

import java.util.Map;

/**
 * @param implementations results keyed by implementation name, in run order
 * @param comparison {@code null} when the implementations could not be compared
 */
public record BenchmarkResults(
    Map<String, ImplementationBenchmark> implementations, BenchmarkComparison comparison) {}
