package com.mk.fx.qa.fanout.execution.load;

import java.time.Instant;

/** A phase entered at a point in time. */
public record PhaseTransition(LoadPhase phase, Instant at) {}
