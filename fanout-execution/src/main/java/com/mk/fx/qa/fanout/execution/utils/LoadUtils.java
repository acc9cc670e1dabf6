package com.mk.fx.qa.fanout.execution.utils;

import com.mk.fx.qa.fanout.client.MockApiClient;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

public final class LoadUtils {

  private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private LoadUtils() {
    // Utility class, no instantiation
  }

  public static String formatTimestamp(Instant instant) {
    return OffsetDateTime.ofInstant(instant, ZoneId.systemDefault())
        .format(MockApiClient.TIMESTAMP_FORMAT);
  }

  public static String nowTimestamp() {
    return formatTimestamp(Instant.now());
  }

  /** Timestamp suitable for result file names, e.g. {@code 20240131_235959}. */
  public static String fileStamp(Instant instant) {
    return OffsetDateTime.ofInstant(instant, ZoneId.systemDefault()).format(FILE_STAMP);
  }

  public static double millisSince(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000.0;
  }

  public static double round2(double value) {
    return Math.round(value * 100.0) / 100.0;
  }

  /** Number of workers derived from the processor count when no explicit value is configured. */
  public static int orProcessorMultiple(int configured, int multiplier) {
    if (configured > 0) {
      return configured;
    }
    return Math.max(1, Runtime.getRuntime().availableProcessors() * multiplier);
  }
}
