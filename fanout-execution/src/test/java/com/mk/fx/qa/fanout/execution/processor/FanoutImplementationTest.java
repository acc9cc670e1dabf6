package com.mk.fx.qa.fanout.execution.processor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

import com.mk.fx.qa.fanout.execution.events.ProcessingEventPublisher;
import com.mk.fx.qa.fanout.execution.metrics.MetricsCollector;
import com.mk.fx.qa.fanout.execution.model.Success;
import com.mk.fx.qa.fanout.execution.model.WorkUnitGenerator;
import com.mk.fx.qa.fanout.execution.pool.ApiClientPool;
import com.mk.fx.qa.fanout.execution.substrate.BoundedWorkerPoolSubstrate;
import com.mk.fx.qa.fanout.execution.substrate.SubstratePolicy;
import com.mk.fx.qa.fanout.execution.support.StubApiClient;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class FanoutImplementationTest {

  private static final FanoutImplementation.Timeouts TIMEOUTS =
      new FanoutImplementation.Timeouts(
          Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(1));

  private static ApiClientPool pool(String source) {
    return new ApiClientPool(source, 8, Duration.ofSeconds(1), () -> StubApiClient.ok(source));
  }

  @Test
  void boundedWorkerPool_processesBatchAndClosesEverything() {
    var substrate = BoundedWorkerPoolSubstrate.fixed("impl-test", 8);
    var fetchSubstrate = BoundedWorkerPoolSubstrate.fixed("impl-test-fetch", 16);
    var primary = pool("primary");
    var secondary = pool("secondary");
    var implementation =
        new BoundedWorkerPoolImplementation(
            substrate,
            fetchSubstrate,
            primary,
            secondary,
            TIMEOUTS,
            BatchFailureMode.DEGRADE_TO_EMPTY,
            mock(ProcessingEventPublisher.class),
            new MetricsCollector());

    var results = implementation.processBatch(WorkUnitGenerator.benchmarkUnits(20));

    assertEquals(BoundedWorkerPoolImplementation.NAME, implementation.getName());
    assertEquals(SubstratePolicy.BOUNDED_WORKER_POOL, implementation.policy());
    assertEquals(20, results.size());
    assertTrue(results.stream().allMatch(r -> r instanceof Success));

    implementation.close();
    implementation.close();

    assertTrue(implementation.isClosed());
    assertTrue(substrate.isShutdown());
    assertTrue(fetchSubstrate.isShutdown());
    assertThrows(IllegalStateException.class, () -> primary.withClient(c -> c.fetch()));
    assertThrows(IllegalStateException.class, () -> secondary.withClient(c -> c.fetch()));
  }

  @Test
  void boundedWorkerPool_buildsItsOwnSubstrateFromBounds() {
    try (var implementation =
        new BoundedWorkerPoolImplementation(
            new BoundedWorkerPoolImplementation.WorkerBounds(1, 4, 0, Duration.ofSeconds(1)),
            pool("primary"),
            pool("secondary"),
            TIMEOUTS,
            BatchFailureMode.STRICT,
            mock(ProcessingEventPublisher.class),
            null)) {
      assertEquals(BatchFailureMode.STRICT, implementation.getDriver().getFailureMode());
      assertEquals(2, implementation.processBatch(WorkUnitGenerator.benchmarkUnits(2)).size());
      assertTrue(implementation.getSubstrate().stats().isPresent());
      assertEquals(
          BoundedWorkerPoolImplementation.FETCH_NAME,
          implementation.getFetchSubstrate().description());
    }
  }

  @Test
  void constructor_rejectsSharedUnitAndFetchSubstrate() {
    var substrate = BoundedWorkerPoolSubstrate.fixed("shared", 2);
    try {
      assertThrows(
          IllegalArgumentException.class,
          () ->
              new BoundedWorkerPoolImplementation(
                  substrate,
                  substrate,
                  pool("primary"),
                  pool("secondary"),
                  TIMEOUTS,
                  BatchFailureMode.DEGRADE_TO_EMPTY,
                  mock(ProcessingEventPublisher.class),
                  null));
    } finally {
      substrate.shutdown(Duration.ofSeconds(1));
    }
  }

  @Test
  void cheapTask_worksOnAnyRuntime() {
    try (var implementation =
        new CheapTaskImplementation(
            4,
            pool("primary"),
            pool("secondary"),
            TIMEOUTS,
            BatchFailureMode.DEGRADE_TO_EMPTY,
            mock(ProcessingEventPublisher.class),
            new MetricsCollector())) {
      assertEquals(CheapTaskImplementation.NAME, implementation.getName());
      var results = implementation.processBatch(WorkUnitGenerator.benchmarkUnits(10));
      assertEquals(10, results.size());
      assertTrue(results.stream().allMatch(r -> r.isSuccess()));
    }
  }
}
