package com.mk.fx.qa.fanout.execution.processor;

import com.mk.fx.qa.fanout.execution.events.BatchFailureEvent;
import com.mk.fx.qa.fanout.execution.events.PerformanceMetricsEvent;
import com.mk.fx.qa.fanout.execution.events.ProcessingEventPublisher;
import com.mk.fx.qa.fanout.execution.exception.BatchFailureException;
import com.mk.fx.qa.fanout.execution.exception.TaskTimeoutException;
import com.mk.fx.qa.fanout.execution.model.Failure;
import com.mk.fx.qa.fanout.execution.model.FailureKind;
import com.mk.fx.qa.fanout.execution.model.ProcessedUnit;
import com.mk.fx.qa.fanout.execution.model.WorkUnit;
import com.mk.fx.qa.fanout.execution.substrate.TaskExecutionSubstrate;
import com.mk.fx.qa.fanout.execution.substrate.TaskHandle;
import com.mk.fx.qa.fanout.execution.utils.LoadUtils;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Fans a batch out to one {@link UnitProcessor} task per unit and collects the results in
 * submission order.
 *
 * <p>Each unit is awaited for at most {@code unitTimeout}, which should be longer than the
 * processor's sub-fetch timeout. A failure at this level is handled according to the configured
 * {@link BatchFailureMode}. With {@link BatchFailureMode#DEGRADE_TO_EMPTY} the whole batch is
 * reported as an empty list, which callers cannot tell apart from an empty input except through
 * the logged {@code batch_failure} event.
 */
@Slf4j
public class BatchDriver {

  @Getter private final String implementationName;
  private final TaskExecutionSubstrate substrate;
  private final UnitProcessor processor;
  @Getter private final Duration unitTimeout;
  @Getter private final BatchFailureMode failureMode;
  private final ProcessingEventPublisher publisher;

  public BatchDriver(
      String implementationName,
      TaskExecutionSubstrate substrate,
      UnitProcessor processor,
      Duration unitTimeout,
      BatchFailureMode failureMode,
      ProcessingEventPublisher publisher) {
    this.implementationName = Objects.requireNonNull(implementationName, "implementationName");
    this.substrate = Objects.requireNonNull(substrate, "substrate");
    this.processor = Objects.requireNonNull(processor, "processor");
    this.unitTimeout = Objects.requireNonNull(unitTimeout, "unitTimeout");
    this.failureMode = Objects.requireNonNull(failureMode, "failureMode");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    if (unitTimeout.compareTo(processor.getSubFetchTimeout()) <= 0) {
      log.warn(
          "Unit timeout {}ms of {} does not exceed the sub-fetch timeout {}ms",
          unitTimeout.toMillis(),
          implementationName,
          processor.getSubFetchTimeout().toMillis());
    }
  }

  /**
   * Processes {@code units} and returns one result per unit in submission order, or an empty list
   * when the batch degraded. Never throws for failures of individual units or of the batch await.
   */
  public List<ProcessedUnit> processBatch(List<WorkUnit> units) {
    Objects.requireNonNull(units, "units");
    if (units.isEmpty()) {
      return List.of();
    }

    long start = System.nanoTime();
    List<ProcessedUnit> results = new ArrayList<>(units.size());
    try {
      List<TaskHandle<ProcessedUnit>> handles = new ArrayList<>(units.size());
      for (WorkUnit unit : units) {
        handles.add(substrate.submit(() -> processor.process(unit)));
      }
      for (int i = 0; i < handles.size(); i++) {
        results.add(awaitUnit(units.get(i), handles.get(i), units.size()));
      }
    } catch (BatchFailureException e) {
      return degrade(units, e);
    } catch (RuntimeException e) {
      return degrade(units, new BatchFailureException(null, describe(e), e));
    }

    double totalMs = LoadUtils.millisSince(start);
    publisher.publishPerformanceMetrics(
        new PerformanceMetricsEvent(
            implementationName,
            units.size(),
            LoadUtils.round2(totalMs),
            LoadUtils.round2(totalMs / units.size()),
            substrate.stats().orElse(null)));
    return results;
  }

  private ProcessedUnit awaitUnit(WorkUnit unit, TaskHandle<ProcessedUnit> handle, int totalUnits) {
    try {
      return substrate.await(handle, unitTimeout);
    } catch (TaskTimeoutException e) {
      return onUnitFailure(unit, totalUnits, FailureKind.TIMEOUT, e);
    } catch (ExecutionException e) {
      return onUnitFailure(
          unit, totalUnits, FailureKind.PROCESSING_ERROR, e.getCause() != null ? e.getCause() : e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return onUnitFailure(unit, totalUnits, FailureKind.PROCESSING_ERROR, e);
    }
  }

  private ProcessedUnit onUnitFailure(
      WorkUnit unit, int totalUnits, FailureKind kind, Throwable error) {
    if (failureMode == BatchFailureMode.DEGRADE_TO_EMPTY) {
      throw new BatchFailureException(unit.id(), describe(error), error);
    }
    var message = describe(error);
    log.warn("Unit {} failed at batch level in {}: {}", unit.id(), implementationName, message);
    publisher.publishBatchFailure(
        new BatchFailureEvent(implementationName, totalUnits, unit.id(), message, false));
    return new Failure(kind, unit.id(), message);
  }

  private List<ProcessedUnit> degrade(List<WorkUnit> units, BatchFailureException e) {
    log.error(
        "Batch of {} units failed in {}, reporting empty result: {}",
        units.size(),
        implementationName,
        e.getMessage());
    publisher.publishBatchFailure(
        new BatchFailureEvent(implementationName, units.size(), e.getUnitId(), e.getMessage(), true));
    return List.of();
  }

  private static String describe(Throwable error) {
    return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
  }
}
