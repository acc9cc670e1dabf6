package com.mk.fx.qa.fanout.execution.processor;

import com.mk.fx.qa.fanout.execution.events.ProcessingEventPublisher;
import com.mk.fx.qa.fanout.execution.metrics.MetricsCollector;
import com.mk.fx.qa.fanout.execution.model.ProcessedUnit;
import com.mk.fx.qa.fanout.execution.model.WorkUnit;
import com.mk.fx.qa.fanout.execution.pool.ApiClientPool;
import com.mk.fx.qa.fanout.execution.substrate.SubstratePolicy;
import com.mk.fx.qa.fanout.execution.substrate.TaskExecutionSubstrate;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * One named fan-out strategy: a substrate for units, a second one for their sub-fetches, a client
 * pool per source, and the processor and batch driver wired on top of them. Owns all of these and
 * releases them on {@link #close()}.
 *
 * <p>Sub-fetches never share a substrate with the units that wait on them, so a saturated unit
 * backlog cannot hold back the fetches its running units depend on.
 */
@Slf4j
public abstract class FanoutImplementation implements AutoCloseable {

  @Getter private final String name;
  @Getter private final TaskExecutionSubstrate substrate;
  @Getter private final TaskExecutionSubstrate fetchSubstrate;
  private final ApiClientPool primary;
  private final ApiClientPool secondary;
  @Getter private final UnitProcessor processor;
  @Getter private final BatchDriver driver;
  private final Duration shutdownTimeout;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  protected FanoutImplementation(
      String name,
      TaskExecutionSubstrate substrate,
      TaskExecutionSubstrate fetchSubstrate,
      ApiClientPool primary,
      ApiClientPool secondary,
      Timeouts timeouts,
      BatchFailureMode failureMode,
      ProcessingEventPublisher publisher,
      MetricsCollector metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.substrate = Objects.requireNonNull(substrate, "substrate");
    this.fetchSubstrate = Objects.requireNonNull(fetchSubstrate, "fetchSubstrate");
    if (substrate == fetchSubstrate) {
      throw new IllegalArgumentException("units and sub-fetches need separate substrates");
    }
    this.primary = Objects.requireNonNull(primary, "primary");
    this.secondary = Objects.requireNonNull(secondary, "secondary");
    Objects.requireNonNull(timeouts, "timeouts");
    this.shutdownTimeout = timeouts.shutdown();
    this.processor =
        new UnitProcessor(
            name, fetchSubstrate, primary, secondary, timeouts.subFetch(), publisher, metrics);
    this.driver =
        new BatchDriver(name, substrate, processor, timeouts.unit(), failureMode, publisher);
    log.info(
        "{} ready - substrate: {}, fetch substrate: {}, sub-fetch timeout: {}ms, unit timeout: {}ms, mode: {}",
        name,
        substrate.description(),
        fetchSubstrate.description(),
        timeouts.subFetch().toMillis(),
        timeouts.unit().toMillis(),
        failureMode);
  }

  public SubstratePolicy policy() {
    return substrate.policy();
  }

  public List<ProcessedUnit> processBatch(List<WorkUnit> units) {
    return driver.processBatch(units);
  }

  /**
   * Stops the unit substrate, then the fetch substrate, then closes every pooled client. Safe to
   * call more than once.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    log.info("Shutting down {}", name);
    substrate.shutdown(shutdownTimeout);
    fetchSubstrate.shutdown(shutdownTimeout);
    primary.shutdown();
    secondary.shutdown();
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Waiting budgets of one implementation.
   *
   * @param subFetch wait for each sub-fetch of a unit
   * @param unit wait for each unit of a batch
   * @param shutdown drain time granted to running tasks on close
   */
  public record Timeouts(Duration subFetch, Duration unit, Duration shutdown) {

    public Timeouts {
      Objects.requireNonNull(subFetch, "subFetch");
      Objects.requireNonNull(unit, "unit");
      Objects.requireNonNull(shutdown, "shutdown");
    }
  }
}
