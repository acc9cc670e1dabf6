package com.mk.fx.qa.fanout.execution.model;

public enum FailureKind {
  TIMEOUT("Processing timeout"),
  PROCESSING_ERROR("Processing failed");

  private final String description;

  FailureKind(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
