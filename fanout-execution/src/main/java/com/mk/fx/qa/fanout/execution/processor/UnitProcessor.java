package com.mk.fx.qa.fanout.execution.processor;

import com.mk.fx.qa.fanout.client.ApiClient;
import com.mk.fx.qa.fanout.client.SubFetchResult;
import com.mk.fx.qa.fanout.execution.events.ApiCallEvent;
import com.mk.fx.qa.fanout.execution.events.ApiErrorEvent;
import com.mk.fx.qa.fanout.execution.events.ProcessingEventPublisher;
import com.mk.fx.qa.fanout.execution.events.UnitFailureEvent;
import com.mk.fx.qa.fanout.execution.exception.TaskTimeoutException;
import com.mk.fx.qa.fanout.execution.metrics.MetricsCollector;
import com.mk.fx.qa.fanout.execution.model.Failure;
import com.mk.fx.qa.fanout.execution.model.FailureKind;
import com.mk.fx.qa.fanout.execution.model.ProcessedUnit;
import com.mk.fx.qa.fanout.execution.model.Success;
import com.mk.fx.qa.fanout.execution.model.WorkUnit;
import com.mk.fx.qa.fanout.execution.pool.ApiClientPool;
import com.mk.fx.qa.fanout.execution.substrate.TaskExecutionSubstrate;
import com.mk.fx.qa.fanout.execution.substrate.TaskHandle;
import com.mk.fx.qa.fanout.execution.utils.LoadUtils;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Processes one {@link WorkUnit} by fetching it from the primary and the secondary source in
 * parallel and merging both results.
 *
 * <p>Each sub-fetch is awaited independently for at most {@code subFetchTimeout}. A unit with a
 * timed-out sub-fetch is always a {@link FailureKind#TIMEOUT} failure, whatever happened to the
 * other sub-fetch; any other error makes it a {@link FailureKind#PROCESSING_ERROR} failure.
 * Partial results are never merged. Timed-out sub-fetches are left running.
 */
@Slf4j
public class UnitProcessor {

  @Getter private final String implementationName;
  private final TaskExecutionSubstrate substrate;
  private final ApiClientPool primary;
  private final ApiClientPool secondary;
  @Getter private final Duration subFetchTimeout;
  private final ProcessingEventPublisher publisher;
  private final MetricsCollector metrics;

  public UnitProcessor(
      String implementationName,
      TaskExecutionSubstrate substrate,
      ApiClientPool primary,
      ApiClientPool secondary,
      Duration subFetchTimeout,
      ProcessingEventPublisher publisher) {
    this(implementationName, substrate, primary, secondary, subFetchTimeout, publisher, null);
  }

  /**
   * @param metrics optional collector receiving one timing sample per sub-fetch attempt, keyed by
   *     {@link #fetchOperation(String, String)}
   */
  public UnitProcessor(
      String implementationName,
      TaskExecutionSubstrate substrate,
      ApiClientPool primary,
      ApiClientPool secondary,
      Duration subFetchTimeout,
      ProcessingEventPublisher publisher,
      MetricsCollector metrics) {
    this.implementationName = Objects.requireNonNull(implementationName, "implementationName");
    this.substrate = Objects.requireNonNull(substrate, "substrate");
    this.primary = Objects.requireNonNull(primary, "primary");
    this.secondary = Objects.requireNonNull(secondary, "secondary");
    this.subFetchTimeout = Objects.requireNonNull(subFetchTimeout, "subFetchTimeout");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.metrics = metrics;
    if (subFetchTimeout.isNegative() || subFetchTimeout.isZero()) {
      throw new IllegalArgumentException("Sub-fetch timeout must be positive");
    }
  }

  /** Metric key under which sub-fetch durations are recorded. */
  public static String fetchOperation(String implementationName, String sourceName) {
    return implementationName + ":" + sourceName + "_fetch";
  }

  public ProcessedUnit process(WorkUnit unit) {
    Objects.requireNonNull(unit, "unit");
    TaskHandle<SubFetchResult> primaryHandle;
    TaskHandle<SubFetchResult> secondaryHandle;
    try {
      primaryHandle = substrate.submit(() -> fetch(primary, unit));
      secondaryHandle = substrate.submit(() -> fetch(secondary, unit));
    } catch (RuntimeException e) {
      return fail(FailureKind.PROCESSING_ERROR, unit, e);
    }

    var primaryOutcome = awaitFetch(primaryHandle);
    var secondaryOutcome = awaitFetch(secondaryHandle);

    if (primaryOutcome.timedOut() || secondaryOutcome.timedOut()) {
      var timedOut = primaryOutcome.timedOut() ? primaryOutcome : secondaryOutcome;
      return fail(FailureKind.TIMEOUT, unit, timedOut.error());
    }
    if (primaryOutcome.error() != null || secondaryOutcome.error() != null) {
      var failed = primaryOutcome.error() != null ? primaryOutcome : secondaryOutcome;
      return fail(FailureKind.PROCESSING_ERROR, unit, failed.error());
    }

    Map<String, SubFetchResult> merged = new LinkedHashMap<>();
    merged.put(primary.getSourceName(), primaryOutcome.result());
    merged.put(secondary.getSourceName(), secondaryOutcome.result());
    return new Success(unit.id(), merged, LoadUtils.nowTimestamp());
  }

  private SubFetchResult fetch(ApiClientPool pool, WorkUnit unit) {
    var source = pool.getSourceName();
    long start = System.nanoTime();
    boolean success = false;
    try {
      var result = pool.withClient(ApiClient::fetch);
      success = true;
      return result;
    } catch (RuntimeException e) {
      publisher.publishApiError(
          new ApiErrorEvent(implementationName, source, unit.id(), describe(e)));
      throw e;
    } finally {
      double durationMs = LoadUtils.millisSince(start);
      publisher.publishApiCall(
          new ApiCallEvent(
              implementationName, source, unit.id(), LoadUtils.round2(durationMs), success));
      if (metrics != null) {
        metrics.recordTiming(fetchOperation(implementationName, source), durationMs);
      }
    }
  }

  private FetchOutcome awaitFetch(TaskHandle<SubFetchResult> handle) {
    try {
      return FetchOutcome.completed(substrate.await(handle, subFetchTimeout));
    } catch (TaskTimeoutException e) {
      return FetchOutcome.timedOut(e);
    } catch (ExecutionException e) {
      return FetchOutcome.failed(e.getCause() != null ? e.getCause() : e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return FetchOutcome.failed(e);
    } catch (RuntimeException e) {
      return FetchOutcome.failed(e);
    }
  }

  private Failure fail(FailureKind kind, WorkUnit unit, Throwable error) {
    var message = describe(error);
    publisher.publishUnitFailure(new UnitFailureEvent(implementationName, kind, unit.id(), message));
    log.debug("Unit {} failed in {}: {} ({})", unit.id(), implementationName, kind, message);
    return new Failure(kind, unit.id(), message);
  }

  private static String describe(Throwable error) {
    if (error == null) {
      return "unknown error";
    }
    return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
  }

  private record FetchOutcome(SubFetchResult result, Throwable error, boolean timedOut) {

    static FetchOutcome completed(SubFetchResult result) {
      return new FetchOutcome(result, null, false);
    }

    static FetchOutcome timedOut(TaskTimeoutException e) {
      return new FetchOutcome(null, e, true);
    }

    static FetchOutcome failed(Throwable error) {
      return new FetchOutcome(null, error, false);
    }
  }
}
