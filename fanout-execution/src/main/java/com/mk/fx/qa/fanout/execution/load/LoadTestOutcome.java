package com.mk.fx.qa.fanout.execution.load;

import java.util.List;
import java.util.Map;

/**
 * Result of a load test suite.
 *
 * @param results final figures keyed by profile name, then implementation name
 * @param comparisons comparison per profile, absent where it could not be computed
 * @param runs every individual run in execution order
 */
public record LoadTestOutcome(
    Map<String, Map<String, LoadProfileResult>> results,
    Map<String, LoadComparison> comparisons,
    List<LoadRun> runs) {}
