package com.mk.fx.qa.fanout.execution.model;

/**
 * Shape of one load run.
 *
 * @param users number of concurrent virtual users
 * @param durationSeconds wall-clock length of the run
 * @param rampUpSeconds window over which user starts are spread linearly
 */
public record LoadProfile(int users, int durationSeconds, int rampUpSeconds) {

  public LoadProfile {
    if (users <= 0) {
      throw new IllegalArgumentException("users must be > 0");
    }
    if (durationSeconds <= 0) {
      throw new IllegalArgumentException("durationSeconds must be > 0");
    }
    if (rampUpSeconds < 0) {
      throw new IllegalArgumentException("rampUpSeconds must be >= 0");
    }
  }
}
