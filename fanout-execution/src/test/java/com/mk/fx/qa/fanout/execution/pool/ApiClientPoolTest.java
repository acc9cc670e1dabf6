package com.mk.fx.qa.fanout.execution.pool;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.fanout.client.ApiClient;
import com.mk.fx.qa.fanout.client.SimulatedApiError;
import com.mk.fx.qa.fanout.execution.support.StubApiClient;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ApiClientPoolTest {

  @Test
  void withClient_returnsResultAndReleasesClient() {
    var pool = new ApiClientPool("primary", 1, Duration.ofMillis(100), () -> StubApiClient.ok("primary"));

    var result = pool.withClient(ApiClient::fetch);

    assertEquals("primary", result.sourceName());
    assertEquals(new PoolStatus(1, 1, 0), pool.status());
  }

  @Test
  void withClient_rethrowsClientFailureAndReleasesClient() {
    var pool =
        new ApiClientPool(
            "secondary", 1, Duration.ofMillis(100), () -> StubApiClient.failing("secondary"));

    var error = assertThrows(SimulatedApiError.class, () -> pool.withClient(ApiClient::fetch));

    assertEquals("secondary API Error", error.getMessage());
    assertEquals(1, pool.status().available());
  }
}
