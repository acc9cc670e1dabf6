package com.mk.fx.qa.fanout.execution.metrics;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.fanout.execution.utils.LoadUtils;
import java.lang.management.ManagementFactory;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.LongSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Concurrently written store of timing, memory and error samples with statistics derived on
 * demand.
 *
 * <p>Owned by the run orchestrator and passed to whoever records into it. Per-key sequences are
 * append-only while a run is in progress; {@link #reset()} is meant to be called between runs.
 * Appends are lock-free and never lost; readers work on a copy of each sequence.
 */
@Slf4j
public class MetricsCollector {

  static final int TRACE_HEAD_FRAMES = 5;

  private final Map<String, Queue<Double>> timings = new ConcurrentHashMap<>();
  private final Map<String, Queue<Long>> memory = new ConcurrentHashMap<>();
  private final Map<String, Queue<ErrorSample>> errors = new ConcurrentHashMap<>();
  private final LongSupplier memorySampler;

  public MetricsCollector() {
    this(MetricsCollector::usedMemoryBytes);
  }

  /** @param memorySampler source of the current memory footprint in bytes */
  public MetricsCollector(LongSupplier memorySampler) {
    this.memorySampler = Objects.requireNonNull(memorySampler, "memorySampler");
  }

  public void recordTiming(String operation, double durationMs) {
    timings.computeIfAbsent(operation, k -> new ConcurrentLinkedQueue<>()).add(durationMs);
  }

  /** Samples the current memory footprint and records it for {@code implementation}. */
  public long recordMemory(String implementation) {
    long sample = memorySampler.getAsLong();
    recordMemoryDelta(implementation, sample);
    return sample;
  }

  /** Records a memory figure measured by the caller, e.g. the growth across one run. */
  public void recordMemoryDelta(String implementation, long bytes) {
    memory.computeIfAbsent(implementation, k -> new ConcurrentLinkedQueue<>()).add(bytes);
  }

  public void recordError(String implementation, Throwable error) {
    errors
        .computeIfAbsent(implementation, k -> new ConcurrentLinkedQueue<>())
        .add(buildErrorSample(error));
  }

  /** Copy of the durations recorded for {@code operation}, in insertion order. */
  public List<Double> timingSamples(String operation) {
    var samples = timings.get(operation);
    return samples == null ? List.of() : List.copyOf(samples);
  }

  public List<Long> memorySamples(String implementation) {
    var samples = memory.get(implementation);
    return samples == null ? List.of() : List.copyOf(samples);
  }

  public List<ErrorSample> errorSamples(String implementation) {
    var samples = errors.get(implementation);
    return samples == null ? List.of() : List.copyOf(samples);
  }

  public MetricsStatistics statistics() {
    Map<String, List<Double>> timingSnapshot = snapshot(timings);
    Map<String, List<Long>> memorySnapshot = snapshot(memory);
    Map<String, List<ErrorSample>> errorSnapshot = snapshot(errors);

    Map<String, TimingStats> timingStats = new LinkedHashMap<>();
    long totalOperations = 0;
    double totalDuration = 0;
    for (var entry : timingSnapshot.entrySet()) {
      var samples = entry.getValue();
      if (samples.isEmpty()) {
        continue;
      }
      timingStats.put(entry.getKey(), timingStats(samples));
      totalOperations += samples.size();
      totalDuration += samples.stream().mapToDouble(Double::doubleValue).sum();
    }

    Map<String, MemoryStats> memoryStats = new LinkedHashMap<>();
    for (var entry : memorySnapshot.entrySet()) {
      var samples = entry.getValue();
      if (samples.isEmpty()) {
        continue;
      }
      var summary = samples.stream().mapToLong(Long::longValue).summaryStatistics();
      memoryStats.put(
          entry.getKey(),
          new MemoryStats(summary.getCount(), summary.getMin(), summary.getMax(), summary.getAverage()));
    }

    Map<String, ErrorRate> errorRates = new LinkedHashMap<>();
    long totalErrors = 0;
    for (var entry : errorSnapshot.entrySet()) {
      long count = entry.getValue().size();
      long timed = timingSnapshot.getOrDefault(entry.getKey(), List.of()).size();
      long attempts = timed > 0 ? timed + count : 1;
      errorRates.put(entry.getKey(), new ErrorRate(count, count / (double) attempts));
      totalErrors += count;
    }

    return new MetricsStatistics(
        Map.copyOf(timingStats),
        Map.copyOf(memoryStats),
        Map.copyOf(errorRates),
        new MetricsSummary(totalOperations, totalErrors, totalDuration));
  }

  /** Drops every sample. Call only while no run is recording. */
  public void reset() {
    timings.clear();
    memory.clear();
    errors.clear();
    log.debug("Metrics collector reset");
  }

  /** Heap plus non-heap memory currently used by the JVM. */
  public static long usedMemoryBytes() {
    var memoryBean = ManagementFactory.getMemoryMXBean();
    return memoryBean.getHeapMemoryUsage().getUsed() + memoryBean.getNonHeapMemoryUsage().getUsed();
  }

  private static TimingStats timingStats(List<Double> samples) {
    double[] sorted = samples.stream().mapToDouble(Double::doubleValue).sorted().toArray();
    double sum = 0;
    for (double v : sorted) {
      sum += v;
    }
    return new TimingStats(
        sorted.length,
        sorted[0],
        sorted[sorted.length - 1],
        sum / sorted.length,
        Percentiles.percentileOfSorted(sorted, 95),
        Percentiles.percentileOfSorted(sorted, 99));
  }

  private static <V> Map<String, List<V>> snapshot(Map<String, Queue<V>> source) {
    Map<String, List<V>> copy = new LinkedHashMap<>();
    source.forEach((key, values) -> copy.put(key, new ArrayList<>(values)));
    return copy;
  }

  @VisibleForTesting
  static ErrorSample buildErrorSample(Throwable t) {
    var time = LoadUtils.nowTimestamp();
    if (t == null) {
      return new ErrorSample(time, "UNKNOWN", "unknown error", List.of());
    }
    Throwable rootCause = t;
    while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
      rootCause = rootCause.getCause();
    }

    String msg = t.getMessage();
    if (msg == null || msg.equals("null")) {
      msg = rootCause.getMessage();
    }
    if (msg == null || msg.equals("null")) {
      msg = rootCause.getClass().getSimpleName() + " occurred";
    }

    List<String> frames = new ArrayList<>(TRACE_HEAD_FRAMES);
    StackTraceElement[] stackTrace = t.getStackTrace();
    int limit = Math.min(TRACE_HEAD_FRAMES, stackTrace.length);
    for (int i = 0; i < limit; i++) {
      frames.add(formatStackFrame(stackTrace[i]));
    }
    return new ErrorSample(time, rootCause.getClass().getSimpleName(), msg, List.copyOf(frames));
  }

  private static String formatStackFrame(StackTraceElement frame) {
    return frame.getClassName()
        + "."
        + frame.getMethodName()
        + "("
        + frame.getFileName()
        + ":"
        + frame.getLineNumber()
        + ")";
  }
}
