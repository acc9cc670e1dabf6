package com.mk.fx.qa.fanout.execution.load;

import com.mk.fx.qa.fanout.execution.metrics.MetricsCollector;
import com.mk.fx.qa.fanout.execution.model.LoadProfile;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs every profile against every implementation, one run at a time, each on a freshly built
 * implementation with a freshly reset collector. The first implementation is the comparison
 * baseline.
 */
@Slf4j
public class LoadTestRunner {

  private final List<ImplementationSupplier> implementations;
  private final LoadGenerator generator;
  private final Map<String, LoadProfile> profiles;
  private final MetricsCollector metrics;

  public LoadTestRunner(
      List<ImplementationSupplier> implementations,
      LoadGenerator generator,
      Map<String, LoadProfile> profiles,
      MetricsCollector metrics) {
    this.implementations = List.copyOf(implementations);
    this.generator = Objects.requireNonNull(generator, "generator");
    this.profiles = new LinkedHashMap<>(Objects.requireNonNull(profiles, "profiles"));
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public LoadTestOutcome run() {
    logConfiguration();
    Map<String, Map<String, LoadProfileResult>> results = new LinkedHashMap<>();
    Map<String, LoadComparison> comparisons = new LinkedHashMap<>();
    List<LoadRun> runs = new ArrayList<>();

    profiles.forEach(
        (profileName, profile) -> {
          log.info("Running {} load profile", profileName);
          Map<String, LoadProfileResult> byImplementation = new LinkedHashMap<>();
          for (var supplier : implementations) {
            metrics.reset();
            try (var implementation = supplier.create(metrics)) {
              var run =
                  generator.run(
                      implementation.getName(), profile, implementation::processBatch, metrics);
              runs.add(run);
              byImplementation.put(implementation.getName(), run.result());
              logProfileResult(profileName, implementation.getName(), run.result());
            }
          }
          results.put(profileName, Collections.unmodifiableMap(byImplementation));
          compare(byImplementation)
              .ifPresent(
                  comparison -> {
                    comparisons.put(profileName, comparison);
                    log.info(
                        "{} profile: throughput improvement {}%, average latency improvement {}%,"
                            + " error rate difference {}%",
                        profileName,
                        comparison.throughputImprovementPercent(),
                        comparison.latencyImprovementPercent(),
                        comparison.errorRateDifference());
                  });
        });

    return new LoadTestOutcome(
        Collections.unmodifiableMap(results),
        Collections.unmodifiableMap(comparisons),
        List.copyOf(runs));
  }

  private static Optional<LoadComparison> compare(
      Map<String, LoadProfileResult> byImplementation) {
    if (byImplementation.size() != 2) {
      return Optional.empty();
    }
    var names = new ArrayList<>(byImplementation.keySet());
    return LoadComparison.compare(
        names.get(0),
        byImplementation.get(names.get(0)),
        names.get(1),
        byImplementation.get(names.get(1)));
  }

  private void logConfiguration() {
    var sb = new StringBuilder("Load test configuration: processors=");
    sb.append(Runtime.getRuntime().availableProcessors())
        .append(", maxMemory=")
        .append(Runtime.getRuntime().maxMemory() / 1024 / 1024)
        .append("MB, profiles=");
    profiles.forEach(
        (name, profile) ->
            sb.append(' ')
                .append(name)
                .append("{users=")
                .append(profile.users())
                .append(", duration=")
                .append(profile.durationSeconds())
                .append("s, rampUp=")
                .append(profile.rampUpSeconds())
                .append("s}"));
    log.info(sb.toString());
  }

  private static void logProfileResult(
      String profileName, String implementation, LoadProfileResult result) {
    log.info(
        "{} results for {} profile: throughput={} req/s, errorRate={}%, latency(ms)"
            + " min={} avg={} max={} p90={} p95={} p99={}, requests={}, errors={}",
        implementation,
        profileName,
        result.throughput(),
        result.errorRate(),
        result.latency().min(),
        result.latency().avg(),
        result.latency().max(),
        result.latency().p90(),
        result.latency().p95(),
        result.latency().p99(),
        result.totalRequests(),
        result.totalErrors());
  }
}
