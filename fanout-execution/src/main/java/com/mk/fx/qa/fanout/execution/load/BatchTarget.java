package com.mk.fx.qa.fanout.execution.load;

import com.mk.fx.qa.fanout.execution.model.ProcessedUnit;
import com.mk.fx.qa.fanout.execution.model.WorkUnit;
import java.util.List;

/** What a virtual user calls on every iteration. */
@FunctionalInterface
public interface BatchTarget {
  List<ProcessedUnit> processBatch(List<WorkUnit> units);
}
