package com.mk.fx.qa.fanout.execution.pool;

import com.mk.fx.qa.fanout.client.ApiClient;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/** Pool of {@link ApiClient} instances for one upstream source. */
@Slf4j
public class ApiClientPool {

  @Getter private final String sourceName;
  private final BoundedResourcePool<ApiClient> pool;
  private final Duration acquireTimeout;

  public ApiClientPool(
      String sourceName, int size, Duration acquireTimeout, Supplier<ApiClient> clientFactory) {
    this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
    this.acquireTimeout = Objects.requireNonNull(acquireTimeout, "acquireTimeout");
    this.pool = new BoundedResourcePool<>(sourceName + "-clients", size, clientFactory);
  }

  /** Runs {@code call} against a leased client, logging and rethrowing any failure. */
  public <R> R withClient(Function<ApiClient, R> call) {
    return pool.with(
        acquireTimeout,
        client -> {
          try {
            return call.apply(client);
          } catch (RuntimeException e) {
            log.error("Error in {}: {}", client, e.getMessage());
            throw e;
          }
        });
  }

  public PoolStatus status() {
    return pool.status();
  }

  public void shutdown() {
    pool.shutdown(ApiClient::close);
  }
}
