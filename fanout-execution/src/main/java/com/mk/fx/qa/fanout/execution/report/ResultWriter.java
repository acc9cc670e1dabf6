package com.mk.fx.qa.fanout.execution.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.fanout.execution.utils.LoadUtils;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes run reports as pretty-printed JSON files named {@code <prefix>_<yyyyMMdd_HHmmss>.json}
 * under the results directory.
 */
@Slf4j
public class ResultWriter {

  public static final String LOAD_TEST_PREFIX = "load_test";
  public static final String BENCHMARK_PREFIX = "benchmark";

  private final ObjectMapper objectMapper;
  private final Path resultsDir;
  private final Clock clock;

  public ResultWriter(ObjectMapper objectMapper, Path resultsDir) {
    this(objectMapper, resultsDir, Clock.systemDefaultZone());
  }

  @VisibleForTesting
  ResultWriter(ObjectMapper objectMapper, Path resultsDir, Clock clock) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.resultsDir = Objects.requireNonNull(resultsDir, "resultsDir");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Creates the results directory if needed.
   *
   * @throws UncheckedIOException if it cannot be created
   */
  public void prepare() {
    try {
      Files.createDirectories(resultsDir);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create results directory " + resultsDir, e);
    }
  }

  /** Wraps {@code results} in a report stamped with the current time. */
  public <T> RunReport<T> report(RunConfiguration configuration, T results) {
    return new RunReport<>(configuration, results, LoadUtils.formatTimestamp(clock.instant()));
  }

  /**
   * Writes {@code report} and returns the file written.
   *
   * @throws UncheckedIOException if the file cannot be written
   */
  public Path write(String prefix, RunReport<?> report) {
    prepare();
    Instant now = clock.instant();
    Path file = resultsDir.resolve(prefix + "_" + LoadUtils.fileStamp(now) + ".json");
    try {
      objectMapper.writeValue(file.toFile(), report);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot write results to " + file, e);
    }
    log.info("Detailed results saved to: {}", file);
    return file;
  }
}
