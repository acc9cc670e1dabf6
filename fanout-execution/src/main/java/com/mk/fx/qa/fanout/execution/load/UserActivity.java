package com.mk.fx.qa.fanout.execution.load;

/**
 * What one virtual user did during a run.
 *
 * @param startOffsetMs time from run start to the user's first iteration
 * @param iterations batch calls the user issued
 */
public record UserActivity(String userId, long startOffsetMs, int iterations) {}
