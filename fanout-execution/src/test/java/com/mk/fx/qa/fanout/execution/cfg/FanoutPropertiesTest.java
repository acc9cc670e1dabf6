package com.mk.fx.qa.fanout.execution.cfg;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.fanout.execution.model.LoadProfile;
import com.mk.fx.qa.fanout.execution.processor.BatchFailureMode;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class FanoutPropertiesTest {

  private static FanoutProperties bind(Map<String, String> values) {
    var binder = new Binder(new MapConfigurationPropertySource(values));
    return binder
        .bind("fanout", Bindable.ofInstance(new FanoutProperties()))
        .orElseGet(FanoutProperties::new);
  }

  @Test
  void defaults_matchDocumentedValues() {
    var properties = new FanoutProperties();

    assertEquals(Duration.ofSeconds(1), properties.getBoundedPool().getSubFetchTimeout());
    assertEquals(Duration.ofSeconds(2), properties.getBoundedPool().getUnitTimeout());
    assertEquals(Duration.ofSeconds(2), properties.getCheapTask().getSubFetchTimeout());
    assertEquals(Duration.ofSeconds(5), properties.getCheapTask().getUnitTimeout());
    assertEquals(BatchFailureMode.DEGRADE_TO_EMPTY, properties.getBatchFailureMode());
    assertEquals(new LoadProfile(50, 60, 10), properties.getLoad().getProfiles().get("medium"));
    assertEquals(1000, properties.getBenchmark().getUnits());
  }

  @Test
  void bind_overridesFromRelaxedKeys() {
    var properties =
        bind(
            Map.of(
                "fanout.batch-failure-mode", "strict",
                "fanout.bounded-pool.max-threads", "12",
                "fanout.sources.primary.latency", "5ms",
                "fanout.load.profiles.smoke.users", "2",
                "fanout.load.profiles.smoke.duration-seconds", "3",
                "fanout.load.profiles.smoke.ramp-up-seconds", "1"));

    assertEquals(BatchFailureMode.STRICT, properties.getBatchFailureMode());
    assertEquals(12, properties.getBoundedPool().getMaxThreads());
    assertEquals(Duration.ofMillis(5), properties.getSources().getPrimary().getLatency());
    assertEquals("primary", properties.getSources().getPrimary().getName());
    assertEquals(new LoadProfile(2, 3, 1), properties.getLoad().getProfiles().get("smoke"));
  }
}
