package com.mk.fx.qa.fanout.execution.report;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.fanout.execution.cfg.ObjectMapperConfig;
import com.mk.fx.qa.fanout.execution.model.LoadProfile;
import com.mk.fx.qa.fanout.execution.utils.LoadUtils;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResultWriterTest {

  private static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");

  @TempDir Path tempDir;

  private ResultWriter writer(Path dir) {
    return new ResultWriter(
        ObjectMapperConfig.createMapper(), dir, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void write_createsTimestampedDocumentInResultsDir() throws Exception {
    var resultsDir = tempDir.resolve("results");
    var writer = writer(resultsDir);
    var configuration = RunConfiguration.forProfiles(Map.of("light", new LoadProfile(10, 30, 5)));
    var report = writer.report(configuration, Map.of("light", Map.of("cheap_task", 1)));

    var file = writer.write(ResultWriter.LOAD_TEST_PREFIX, report);

    assertEquals(resultsDir, file.getParent());
    assertEquals("load_test_" + LoadUtils.fileStamp(NOW) + ".json", file.getFileName().toString());
    var tree = ObjectMapperConfig.createMapper().readTree(Files.readString(file));
    assertEquals(LoadUtils.formatTimestamp(NOW), tree.get("timestamp").asText());
    assertEquals(1, tree.at("/results/light/cheap_task").asInt());
    assertEquals(
        10, tree.at("/configuration/settings/load_profiles/light/users").asInt());
    assertEquals(
        30, tree.at("/configuration/settings/load_profiles/light/duration_seconds").asInt());
    assertTrue(tree.get("configuration").has("java_version"));
    assertTrue(tree.get("configuration").get("processors").asInt() > 0);
  }

  @Test
  void prepare_failsWhenResultsDirIsAFile() throws Exception {
    var blocker = Files.createFile(tempDir.resolve("blocker"));

    assertThrows(UncheckedIOException.class, () -> writer(blocker).prepare());
  }
}
