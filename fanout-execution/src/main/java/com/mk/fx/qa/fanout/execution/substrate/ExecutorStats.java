package com.mk.fx.qa.fanout.execution.substrate;

/**
 * Point-in-time view of a bounded worker pool.
 *
 * @param completedTasks tasks completed since the pool started (approximate)
 * @param queueLength tasks waiting in the backlog
 * @param poolSize current number of worker threads
 * @param activeThreads workers currently running a task (approximate)
 */
public record ExecutorStats(long completedTasks, int queueLength, int poolSize, int activeThreads) {}
