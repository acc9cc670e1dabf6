package com.mk.fx.qa.fanout.execution.load;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Tracks the phase of a load run. Phases only move forward; skipping a phase is allowed so a run
 * that never reaches steady state can still stop and report.
 */
@Slf4j
public class LoadPhaseTracker {

  private final String runName;
  private final AtomicReference<LoadPhase> current = new AtomicReference<>(LoadPhase.IDLE);
  private final List<PhaseTransition> transitions = new CopyOnWriteArrayList<>();

  public LoadPhaseTracker(String runName) {
    this.runName = runName;
    transitions.add(new PhaseTransition(LoadPhase.IDLE, Instant.now()));
  }

  /**
   * Moves to {@code next} if it lies ahead of the current phase.
   *
   * @return false if the run is already at or past {@code next}
   */
  public boolean advanceTo(LoadPhase next) {
    while (true) {
      var phase = current.get();
      if (phase.ordinal() >= next.ordinal()) {
        return false;
      }
      if (current.compareAndSet(phase, next)) {
        transitions.add(new PhaseTransition(next, Instant.now()));
        log.info("Load run {} phase {} -> {}", runName, phase, next);
        return true;
      }
    }
  }

  public LoadPhase current() {
    return current.get();
  }

  public List<PhaseTransition> transitions() {
    return List.copyOf(transitions);
  }
}
