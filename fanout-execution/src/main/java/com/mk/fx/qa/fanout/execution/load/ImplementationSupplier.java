package com.mk.fx.qa.fanout.execution.load;

import com.mk.fx.qa.fanout.execution.metrics.MetricsCollector;
import com.mk.fx.qa.fanout.execution.processor.FanoutImplementation;

/** Creates a fresh implementation recording into the given collector. The caller closes it. */
@FunctionalInterface
public interface ImplementationSupplier {
  FanoutImplementation create(MetricsCollector metrics);
}
