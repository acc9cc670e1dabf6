package com.mk.fx.qa.fanout.execution.substrate;

import com.mk.fx.qa.fanout.execution.exception.SubstrateUnavailableException;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;

/**
 * One cheap task per submission with no ceiling of its own; concurrency is bounded only by what
 * the tasks contend for, such as client pools.
 *
 * <p>{@link #virtualThreads(String)} binds to the runtime's virtual-thread-per-task executor, which
 * is looked up reflectively so the class still loads on runtimes that lack it.
 */
@Slf4j
public class CheapTaskSubstrate extends ExecutorServiceSubstrate {

  private static final String PER_TASK_FACTORY = "newVirtualThreadPerTaskExecutor";

  private final String name;

  public CheapTaskSubstrate(String name, ExecutorService perTaskExecutor) {
    super(perTaskExecutor);
    this.name = name;
    log.info("{} initialised - executor: {}", name, perTaskExecutor.getClass().getSimpleName());
  }

  /**
   * Builds a substrate on virtual threads.
   *
   * @throws SubstrateUnavailableException if this runtime has no virtual-thread executor
   */
  public static CheapTaskSubstrate virtualThreads(String name) {
    return new CheapTaskSubstrate(name, newVirtualThreadPerTaskExecutor());
  }

  /** Returns true when the runtime can provide a virtual-thread-per-task executor. */
  public static boolean isVirtualThreadSupportAvailable() {
    try {
      perTaskFactory();
      return true;
    } catch (ReflectiveOperationException e) {
      return false;
    }
  }

  private static ExecutorService newVirtualThreadPerTaskExecutor() {
    try {
      return (ExecutorService) perTaskFactory().invoke();
    } catch (ReflectiveOperationException e) {
      throw new SubstrateUnavailableException(
          "Virtual thread executor is not available on Java " + Runtime.version().feature(), e);
    } catch (Throwable t) {
      throw new SubstrateUnavailableException(
          "Failed to create virtual thread executor: " + t.getMessage(), t);
    }
  }

  private static MethodHandle perTaskFactory() throws ReflectiveOperationException {
    return MethodHandles.publicLookup()
        .findStatic(
            Executors.class, PER_TASK_FACTORY, MethodType.methodType(ExecutorService.class));
  }

  @Override
  public SubstratePolicy policy() {
    return SubstratePolicy.CHEAP_TASK;
  }

  @Override
  public String description() {
    return name;
  }

  @Override
  public Optional<ExecutorStats> stats() {
    return Optional.empty();
  }
}
