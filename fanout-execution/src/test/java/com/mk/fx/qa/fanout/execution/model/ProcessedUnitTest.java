package com.mk.fx.qa.fanout.execution.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ProcessedUnitTest {

  @Test
  void onlySuccessAndFailureMayImplementIt() {
    assertTrue(ProcessedUnit.class.isSealed());
    assertArrayEquals(
        new Class<?>[] {Success.class, Failure.class}, ProcessedUnit.class.getPermittedSubclasses());
  }

  @Test
  void isSuccess_matchesVariant() {
    ProcessedUnit success = new Success("unit-1", Map.of(), "2026-01-01T00:00:00Z");
    ProcessedUnit failure = new Failure(FailureKind.TIMEOUT, "unit-2", "timed out");

    assertTrue(success.isSuccess());
    assertFalse(failure.isSuccess());
    assertEquals("unit-2", failure.unitId());
  }
}
