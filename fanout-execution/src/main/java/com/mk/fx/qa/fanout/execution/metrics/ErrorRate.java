package com.mk.fx.qa.fanout.execution.metrics;

/**
 * Errors recorded for one implementation.
 *
 * @param count number of errors
 * @param rate errors divided by attempts (errors plus timings recorded under the same name), or
 *     by one when no timings were recorded under that name
 */
public record ErrorRate(long count, double rate) {}
