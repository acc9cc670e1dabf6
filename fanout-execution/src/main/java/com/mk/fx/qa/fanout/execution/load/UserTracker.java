package com.mk.fx.qa.fanout.execution.load;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Start offsets and iteration counts of the virtual users of one run. */
final class UserTracker {
  private final long runStartNanos;
  private final AtomicInteger usersStarted = new AtomicInteger();
  private final AtomicInteger usersStopped = new AtomicInteger();
  private final Map<String, Long> startOffsetsMillis = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> iterations = new ConcurrentHashMap<>();

  UserTracker(long runStartNanos) {
    this.runStartNanos = runStartNanos;
  }

  void onUserStarted(String userId) {
    startOffsetsMillis.put(userId, (System.nanoTime() - runStartNanos) / 1_000_000L);
    iterations.putIfAbsent(userId, new AtomicInteger());
    usersStarted.incrementAndGet();
  }

  void onIterationCompleted(String userId) {
    iterations.computeIfAbsent(userId, k -> new AtomicInteger()).incrementAndGet();
  }

  void onUserStopped(String userId) {
    usersStopped.incrementAndGet();
  }

  int totalUsersStarted() {
    return usersStarted.get();
  }

  int activeUsers() {
    return usersStarted.get() - usersStopped.get();
  }

  List<UserActivity> activity() {
    List<UserActivity> activity = new ArrayList<>();
    startOffsetsMillis.forEach(
        (userId, offset) ->
            activity.add(
                new UserActivity(
                    userId, offset, iterations.getOrDefault(userId, new AtomicInteger()).get())));
    activity.sort((a, b) -> Long.compare(a.startOffsetMs(), b.startOffsetMs()));
    return List.copyOf(activity);
  }
}
