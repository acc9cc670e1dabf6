package com.mk.fx.qa.fanout.execution.command;

import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Dispatches the mode named by the first non-option argument.
 *
 * <p>Exit codes: 0 once the mode ran, even if individual batches or requests failed; 1 when the
 * mode could not be set up or aborted; 2 when the mode is missing or unknown.
 */
@Slf4j
@Component
public class CommandRunner implements ApplicationRunner, ExitCodeGenerator {

  static final int EXIT_OK = 0;
  static final int EXIT_SETUP_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  private final EnvironmentCheck environmentCheck;
  private final BenchmarkCommand benchmarkCommand;
  private final LoadTestCommand loadTestCommand;
  private volatile int exitCode = EXIT_OK;

  public CommandRunner(
      EnvironmentCheck environmentCheck,
      BenchmarkCommand benchmarkCommand,
      LoadTestCommand loadTestCommand) {
    this.environmentCheck = environmentCheck;
    this.benchmarkCommand = benchmarkCommand;
    this.loadTestCommand = loadTestCommand;
  }

  @Override
  public void run(ApplicationArguments args) {
    var nonOptionArgs = args.getNonOptionArgs();
    var argument = nonOptionArgs.isEmpty() ? null : nonOptionArgs.get(0);
    var mode = RunMode.fromArgument(argument);
    if (mode.isEmpty()) {
      log.error(
          "Unknown or missing mode '{}'. Expected one of {}",
          argument,
          Arrays.stream(RunMode.values()).map(RunMode::argument).toList());
      exitCode = EXIT_USAGE;
      return;
    }

    log.info("Running mode {}", mode.get().argument());
    try {
      switch (mode.get()) {
        case ENV -> environmentCheck.run();
        case BENCHMARK -> benchmarkCommand.run();
        case LOAD -> loadTestCommand.run();
      }
      exitCode = EXIT_OK;
    } catch (RuntimeException e) {
      log.error("Mode {} failed: {}", mode.get().argument(), e.getMessage(), e);
      exitCode = EXIT_SETUP_FAILURE;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
