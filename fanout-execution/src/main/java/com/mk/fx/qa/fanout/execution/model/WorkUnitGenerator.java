package com.mk.fx.qa.fanout.execution.model;

import com.mk.fx.qa.fanout.execution.utils.LoadUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Produces the work units fed to benchmarks and virtual users. */
public final class WorkUnitGenerator {

  public static final String UNIT_KIND = "test_unit";
  private static final int UNITS_PER_BENCHMARK_BATCH = 100;

  private WorkUnitGenerator() {
    // Utility class, no instantiation
  }

  /** Benchmark units with sequential ids and a {@code batch} tag per hundred units. */
  public static List<WorkUnit> benchmarkUnits(int count) {
    List<WorkUnit> units = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      units.add(
          new WorkUnit(
              Integer.toString(i),
              UNIT_KIND,
              LoadUtils.nowTimestamp(),
              Map.of("sequence", i, "batch", "test_" + (i / UNITS_PER_BENCHMARK_BATCH))));
    }
    return List.copyOf(units);
  }

  /** Units with random ids, as assigned to a virtual user. */
  public static List<WorkUnit> randomUnits(int count) {
    List<WorkUnit> units = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      units.add(
          new WorkUnit(
              UUID.randomUUID().toString(),
              UNIT_KIND,
              LoadUtils.nowTimestamp(),
              Map.of("sequence", i)));
    }
    return List.copyOf(units);
  }

  /** Creates {@code count} users named {@code user_<index>}, each with its own unit set. */
  public static List<VirtualUser> virtualUsers(int count, int unitsPerUser) {
    List<VirtualUser> users = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      users.add(new VirtualUser("user_" + i, randomUnits(unitsPerUser)));
    }
    return List.copyOf(users);
  }
}
