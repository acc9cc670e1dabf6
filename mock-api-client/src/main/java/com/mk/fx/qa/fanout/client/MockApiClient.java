package com.mk.fx.qa.fanout.client;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Simulated upstream client. Each {@link #fetch()} sleeps for the configured latency and then
 * either fails with {@link SimulatedApiError} (with probability {@code errorRate}) or returns a
 * small generated payload. This implementation does not include retry logic.
 */
@Slf4j
public class MockApiClient implements ApiClient {

  /** Timestamp format shared by every generated envelope. */
  public static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ");

  private static final List<String> CATEGORIES = List.of("Electronics", "Fashion", "Home");
  private static final int ITEMS_PER_PAYLOAD = 3;

  /** Source name reported in results and errors. */
  private final String sourceName;

  /** Simulated call latency. */
  private final Duration latency;

  /** Probability in [0, 1] that a call fails. */
  private final double errorRate;

  /** Source of randomness for the failure draw. */
  private final DoubleSupplier failureDraw;

  public MockApiClient(String sourceName, Duration latency, double errorRate) {
    this(sourceName, latency, errorRate, () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * Constructs a client with an explicit failure draw, mainly so tests can force outcomes.
   *
   * @param sourceName source name reported in results
   * @param latency simulated latency per call
   * @param errorRate failure probability in [0, 1]
   * @param failureDraw supplier of values in [0, 1) compared against {@code errorRate}
   */
  public MockApiClient(
      String sourceName, Duration latency, double errorRate, DoubleSupplier failureDraw) {
    this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
    this.latency = latency != null ? latency : Duration.ZERO;
    if (errorRate < 0.0 || errorRate > 1.0) {
      throw new IllegalArgumentException("errorRate must be between 0 and 1");
    }
    this.errorRate = errorRate;
    this.failureDraw = Objects.requireNonNull(failureDraw, "failureDraw");
    log.debug(
        "MockApiClient initialised - source: {}, latency: {}ms, errorRate: {}",
        sourceName,
        this.latency.toMillis(),
        errorRate);
  }

  @Override
  public String sourceName() {
    return sourceName;
  }

  @Override
  public SubFetchResult fetch() {
    simulateLatency();
    if (failureDraw.getAsDouble() < errorRate) {
      throw new SimulatedApiError(sourceName);
    }
    return new SubFetchResult(
        sourceName, UUID.randomUUID().toString(), now(), generatePayload());
  }

  private void simulateLatency() {
    if (latency.isZero() || latency.isNegative()) {
      return;
    }
    try {
      TimeUnit.NANOSECONDS.sleep(latency.toNanos());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SimulatedApiError(sourceName);
    }
  }

  private Map<String, Object> generatePayload() {
    var random = ThreadLocalRandom.current();
    List<Map<String, Object>> items = new ArrayList<>(ITEMS_PER_PAYLOAD);
    for (int i = 0; i < ITEMS_PER_PAYLOAD; i++) {
      Map<String, Object> item = new LinkedHashMap<>();
      item.put("id", UUID.randomUUID().toString());
      item.put("name", "Item " + random.nextInt(1000));
      item.put("price", Math.round(random.nextDouble() * 100 * 100) / 100.0);
      item.put("category", CATEGORIES.get(random.nextInt(CATEGORIES.size())));
      items.add(item);
    }
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("total", ITEMS_PER_PAYLOAD);
    metadata.put("page", 1);
    metadata.put("timestamp", System.currentTimeMillis() / 1000);

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("items", List.copyOf(items));
    payload.put("metadata", metadata);
    return payload;
  }

  private static String now() {
    return OffsetDateTime.now().format(TIMESTAMP_FORMAT);
  }

  @Override
  public String toString() {
    return "MockApiClient[" + sourceName + "]";
  }
}
