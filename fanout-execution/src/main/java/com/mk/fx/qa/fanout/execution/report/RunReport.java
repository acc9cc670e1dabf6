package com.mk.fx.qa.fanout.execution.report;

import java.util.Objects;

/**
 * Document written once per run.
 *
 * @param timestamp formatted time the document was produced
 * @param <T> mode-specific results
 */
public record RunReport<T>(RunConfiguration configuration, T results, String timestamp) {

  public RunReport {
    Objects.requireNonNull(configuration, "configuration");
    Objects.requireNonNull(results, "results");
    Objects.requireNonNull(timestamp, "timestamp");
  }
}
