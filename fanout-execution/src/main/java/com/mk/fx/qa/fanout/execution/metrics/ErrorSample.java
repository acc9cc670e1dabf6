package com.mk.fx.qa.fanout.execution.metrics;

import java.util.List;

/**
 * One recorded error.
 *
 * @param time formatted time of the failure
 * @param type simple class name of the root cause
 * @param message error message, falling back to the root cause's
 * @param traceHead first stack frames of the error
 */
public record ErrorSample(String time, String type, String message, List<String> traceHead) {}
