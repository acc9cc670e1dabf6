package com.mk.fx.qa.fanout.execution.processor;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.fanout.client.MockApiClient;
import com.mk.fx.qa.fanout.execution.cfg.FanoutProperties;
import com.mk.fx.qa.fanout.execution.events.ProcessingEventPublisher;
import com.mk.fx.qa.fanout.execution.metrics.MetricsCollector;
import com.mk.fx.qa.fanout.execution.pool.ApiClientPool;
import com.mk.fx.qa.fanout.execution.utils.LoadUtils;
import java.util.List;
import org.springframework.stereotype.Component;

/** Builds fresh, independently owned implementations from {@link FanoutProperties}. */
@Component
public class FanoutImplementationFactory {

  private final FanoutProperties properties;
  private final ProcessingEventPublisher publisher;

  public FanoutImplementationFactory(
      FanoutProperties properties, ProcessingEventPublisher publisher) {
    this.properties = properties;
    this.publisher = publisher;
  }

  /** Both implementations, bounded worker pool first. The caller closes them. */
  public List<FanoutImplementation> createAll(MetricsCollector metrics) {
    var bounded = boundedWorkerPool(metrics);
    try {
      return List.of(bounded, cheapTask(metrics));
    } catch (RuntimeException e) {
      bounded.close();
      throw e;
    }
  }

  public BoundedWorkerPoolImplementation boundedWorkerPool(MetricsCollector metrics) {
    var cfg = properties.getBoundedPool();
    int maxThreads = LoadUtils.orProcessorMultiple(cfg.getMaxThreads(), 2);
    var workers =
        new BoundedWorkerPoolImplementation.WorkerBounds(
            Math.min(cfg.getMinThreads(), maxThreads),
            maxThreads,
            LoadUtils.orProcessorMultiple(cfg.getQueueCapacity(), 4),
            cfg.getIdleTimeout());
    return new BoundedWorkerPoolImplementation(
        workers,
        clientPool(properties.getSources().getPrimary()),
        clientPool(properties.getSources().getSecondary()),
        new FanoutImplementation.Timeouts(
            cfg.getSubFetchTimeout(), cfg.getUnitTimeout(), cfg.getShutdownTimeout()),
        properties.getBatchFailureMode(),
        publisher,
        metrics);
  }

  public CheapTaskImplementation cheapTask(MetricsCollector metrics) {
    var cfg = properties.getCheapTask();
    return new CheapTaskImplementation(
        LoadUtils.orProcessorMultiple(cfg.getFallbackThreads(), 2),
        clientPool(properties.getSources().getPrimary()),
        clientPool(properties.getSources().getSecondary()),
        new FanoutImplementation.Timeouts(
            cfg.getSubFetchTimeout(), cfg.getUnitTimeout(), cfg.getShutdownTimeout()),
        properties.getBatchFailureMode(),
        publisher,
        metrics);
  }

  @VisibleForTesting
  ApiClientPool clientPool(FanoutProperties.Source source) {
    var pool = properties.getClientPool();
    return new ApiClientPool(
        source.getName(),
        pool.getSize(),
        pool.getAcquireTimeout(),
        () -> new MockApiClient(source.getName(), source.getLatency(), source.getErrorRate()));
  }
}
