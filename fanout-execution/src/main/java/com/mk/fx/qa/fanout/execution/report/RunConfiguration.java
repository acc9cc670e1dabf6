package com.mk.fx.qa.fanout.execution.report;

import com.mk.fx.qa.fanout.execution.model.LoadProfile;
import java.util.Map;

/**
 * Environment and settings a result document was produced with.
 *
 * @param settings mode-specific settings such as load profiles or benchmark sizes
 */
public record RunConfiguration(
    String javaVersion,
    String javaVendor,
    String vmName,
    int processors,
    long maxMemoryMb,
    String host,
    String triggeredBy,
    Map<String, Object> settings) {

  /** Captures the current environment alongside {@code settings}. */
  public static RunConfiguration capture(Map<String, Object> settings) {
    return new RunConfiguration(
        EnvironmentInfo.javaVersion(),
        EnvironmentInfo.javaVendor(),
        EnvironmentInfo.vmName(),
        EnvironmentInfo.processors(),
        EnvironmentInfo.maxMemoryMb(),
        EnvironmentInfo.host(),
        EnvironmentInfo.triggeredBy(),
        settings != null ? Map.copyOf(settings) : Map.of());
  }

  public static RunConfiguration forProfiles(Map<String, LoadProfile> profiles) {
    return capture(Map.of("load_profiles", profiles));
  }
}
