package com.mk.fx.qa.fanout.execution.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.fanout.execution.benchmark.BenchmarkRunner;
import com.mk.fx.qa.fanout.execution.cfg.FanoutProperties;
import com.mk.fx.qa.fanout.execution.metrics.MetricsCollector;
import com.mk.fx.qa.fanout.execution.processor.FanoutImplementation;
import com.mk.fx.qa.fanout.execution.processor.FanoutImplementationFactory;
import com.mk.fx.qa.fanout.execution.report.ResultWriter;
import com.mk.fx.qa.fanout.execution.report.RunConfiguration;
import java.nio.file.Path;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Single-shot benchmark of both implementations, written to {@code benchmark_*.json}. */
@Component
public class BenchmarkCommand {

  private final FanoutProperties properties;
  private final FanoutImplementationFactory factory;
  private final ObjectMapper objectMapper;

  public BenchmarkCommand(
      FanoutProperties properties, FanoutImplementationFactory factory, ObjectMapper objectMapper) {
    this.properties = properties;
    this.factory = factory;
    this.objectMapper = objectMapper;
  }

  /** Runs the benchmark and returns the result file. */
  public Path run() {
    var writer = new ResultWriter(objectMapper, Path.of(properties.getResultsDir()));
    writer.prepare();

    var cfg = properties.getBenchmark();
    var runner =
        new BenchmarkRunner(
            cfg.getUnits(), cfg.getIterations(), cfg.getWarmupUnits(), cfg.getWarmupTimeout());
    var metrics = new MetricsCollector();
    var implementations = factory.createAll(metrics);
    try {
      var results = runner.run(implementations, metrics);
      var configuration =
          RunConfiguration.capture(
              Map.of(
                  "units", cfg.getUnits(),
                  "iterations", cfg.getIterations(),
                  "warmup_units", cfg.getWarmupUnits()));
      return writer.write(ResultWriter.BENCHMARK_PREFIX, writer.report(configuration, results));
    } finally {
      implementations.forEach(FanoutImplementation::close);
    }
  }
}
