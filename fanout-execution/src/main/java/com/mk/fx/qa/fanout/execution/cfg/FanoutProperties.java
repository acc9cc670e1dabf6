package com.mk.fx.qa.fanout.execution.cfg;

import com.mk.fx.qa.fanout.execution.model.LoadProfile;
import com.mk.fx.qa.fanout.execution.processor.BatchFailureMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "fanout")
public class FanoutProperties {

  @NotBlank private String resultsDir = "results";

  @Valid private Sources sources = new Sources();

  @Valid private ClientPool clientPool = new ClientPool();

  @Valid private BoundedPool boundedPool = new BoundedPool();

  @Valid private CheapTask cheapTask = new CheapTask();

  @NotNull private BatchFailureMode batchFailureMode = BatchFailureMode.DEGRADE_TO_EMPTY;

  @Valid private Load load = new Load();

  @Valid private Benchmark benchmark = new Benchmark();

  @Data
  public static class Sources {
    @Valid private Source primary = new Source("primary", Duration.ofMillis(100), 0.01);
    @Valid private Source secondary = new Source("secondary", Duration.ofMillis(150), 0.01);
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Source {
    @NotBlank private String name;
    @NotNull private Duration latency = Duration.ZERO;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double errorRate;
  }

  @Data
  public static class ClientPool {
    /** Clients per source. */
    @Positive private int size = 256;

    @NotNull private Duration acquireTimeout = Duration.ofSeconds(5);
  }

  @Data
  public static class BoundedPool {
    @Positive private int minThreads = 2;

    /** 0 means twice the processor count. */
    @Min(0)
    private int maxThreads = 0;

    /** 0 means four times the processor count. */
    @Min(0)
    private int queueCapacity = 0;

    @NotNull private Duration idleTimeout = Duration.ofSeconds(60);
    @NotNull private Duration subFetchTimeout = Duration.ofSeconds(1);
    @NotNull private Duration unitTimeout = Duration.ofSeconds(2);
    @NotNull private Duration shutdownTimeout = Duration.ofSeconds(5);
  }

  @Data
  public static class CheapTask {
    /** Workers of the fixed pool used when cheap tasks are unavailable; 0 means 2 x processors. */
    @Min(0)
    private int fallbackThreads = 0;

    @NotNull private Duration subFetchTimeout = Duration.ofSeconds(2);
    @NotNull private Duration unitTimeout = Duration.ofSeconds(5);
    @NotNull private Duration shutdownTimeout = Duration.ofSeconds(5);
  }

  @Data
  public static class Load {
    @Positive private int unitsPerUser = 10;
    @NotNull private Duration maxThinkTime = Duration.ofMillis(500);
    @NotNull private Duration monitorInterval = Duration.ofSeconds(1);

    @NotEmpty private Map<String, LoadProfile> profiles = defaultProfiles();

    private static Map<String, LoadProfile> defaultProfiles() {
      Map<String, LoadProfile> profiles = new LinkedHashMap<>();
      profiles.put("light", new LoadProfile(10, 30, 5));
      profiles.put("medium", new LoadProfile(50, 60, 10));
      profiles.put("heavy", new LoadProfile(100, 120, 20));
      return profiles;
    }
  }

  @Data
  public static class Benchmark {
    @Positive private int units = 1000;
    @Positive private int iterations = 3;
    @Min(0)
    private int warmupUnits = 10;

    @NotNull private Duration warmupTimeout = Duration.ofSeconds(5);
  }
}
