package com.mk.fx.qa.fanout.execution.command;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Modes selectable by the first command-line argument. */
public enum RunMode {
  ENV("env"),
  BENCHMARK("benchmark"),
  LOAD("load");

  private final String argument;

  RunMode(String argument) {
    this.argument = argument;
  }

  public String argument() {
    return argument;
  }

  public static Optional<RunMode> fromArgument(String value) {
    if (value == null) {
      return Optional.empty();
    }
    var normalised = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(m -> m.argument.equals(normalised)).findFirst();
  }
}
