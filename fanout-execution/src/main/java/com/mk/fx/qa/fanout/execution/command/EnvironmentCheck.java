package com.mk.fx.qa.fanout.execution.command;

import com.mk.fx.qa.fanout.execution.report.EnvironmentInfo;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Reports the runtime the benchmarks would run on. */
@Slf4j
@Component
public class EnvironmentCheck {

  public Map<String, Object> run() {
    Map<String, Object> facts = new LinkedHashMap<>();
    facts.put("java_version", EnvironmentInfo.javaVersion());
    facts.put("java_vendor", EnvironmentInfo.javaVendor());
    facts.put("vm_name", EnvironmentInfo.vmName());
    facts.put("processors", EnvironmentInfo.processors());
    facts.put("max_memory_mb", EnvironmentInfo.maxMemoryMb());
    facts.put("total_memory_mb", EnvironmentInfo.totalMemoryMb());
    facts.put("free_memory_mb", EnvironmentInfo.freeMemoryMb());
    facts.put("host", EnvironmentInfo.host());
    facts.put("triggered_by", EnvironmentInfo.triggeredBy());
    facts.put("cheap_tasks_available", EnvironmentInfo.cheapTasksAvailable());

    log.info("Java environment:");
    facts.forEach((key, value) -> log.info("  {}: {}", key, value));
    return facts;
  }
}
