package com.mk.fx.qa.fanout.execution.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.fanout.execution.cfg.FanoutProperties;
import com.mk.fx.qa.fanout.execution.load.LoadGenerator;
import com.mk.fx.qa.fanout.execution.load.LoadTestRunner;
import com.mk.fx.qa.fanout.execution.load.ThinkTimeStrategy;
import com.mk.fx.qa.fanout.execution.metrics.MetricsCollector;
import com.mk.fx.qa.fanout.execution.processor.FanoutImplementationFactory;
import com.mk.fx.qa.fanout.execution.report.ResultWriter;
import com.mk.fx.qa.fanout.execution.report.RunConfiguration;
import java.nio.file.Path;
import java.util.List;
import org.springframework.stereotype.Component;

/** Ramped load test of every configured profile, written to {@code load_test_*.json}. */
@Component
public class LoadTestCommand {

  private final FanoutProperties properties;
  private final FanoutImplementationFactory factory;
  private final ObjectMapper objectMapper;

  public LoadTestCommand(
      FanoutProperties properties, FanoutImplementationFactory factory, ObjectMapper objectMapper) {
    this.properties = properties;
    this.factory = factory;
    this.objectMapper = objectMapper;
  }

  /** Runs the suite and returns the result file. */
  public Path run() {
    var writer = new ResultWriter(objectMapper, Path.of(properties.getResultsDir()));
    writer.prepare();

    var load = properties.getLoad();
    var generator =
        new LoadGenerator(
            load.getUnitsPerUser(),
            new ThinkTimeStrategy(load.getMaxThinkTime()),
            load.getMonitorInterval());
    var runner =
        new LoadTestRunner(
            List.of(factory::boundedWorkerPool, factory::cheapTask),
            generator,
            load.getProfiles(),
            new MetricsCollector());

    var outcome = runner.run();
    var report =
        writer.report(RunConfiguration.forProfiles(load.getProfiles()), outcome.results());
    return writer.write(ResultWriter.LOAD_TEST_PREFIX, report);
  }
}
