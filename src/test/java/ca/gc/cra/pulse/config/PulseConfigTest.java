package ca.gc.cra.pulse.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pulse.domain.protocol.FrameFormat;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PulseConfigTest {

  @Test
  void defaultsAreUsable() {
    PulseConfig config = PulseConfig.defaults();

    assertEquals(PulseConfig.DEFAULT_CHUNK_SIZE, config.chunkSize());
    assertEquals(FrameFormat.DEFAULT_SENTINEL, config.sentinel());
    assertEquals(80, config.surfaceWidth());
    assertEquals(24, config.surfaceHeight());
    assertTrue(config.mergeStderr());
    assertFalse(config.stdSymbols());
    assertTrue(config.rootPath().isAbsolute());
  }

  @Test
  void fromMapParsesEveryOption() {
    PulseConfig config = PulseConfig.fromMap(Map.of(
        "command", "  engine   --verbose tests ",
        "workDir", "/srv/project",
        "chunkSize", "4096",
        "sentinel", "@@frame@@",
        "surfaceWidth", "120",
        "surfaceHeight", "40",
        "stdSymbols", "TRUE",
        "mergeStderr", "false",
        "selection", "a.py::t1, b.py::t2,,",
        "input", "run.log"));

    assertEquals(List.of("engine", "--verbose", "tests"), config.command());
    assertEquals(Optional.of(Path.of("/srv/project")), config.workDir());
    assertEquals(Path.of("/srv/project"), config.rootPath());
    assertEquals(4096, config.chunkSize());
    assertEquals("@@frame@@", config.frameFormat().sentinel());
    assertEquals(120, config.surfaceWidth());
    assertEquals(40, config.surfaceHeight());
    assertTrue(config.stdSymbols());
    assertFalse(config.mergeStderr());
    assertEquals(Set.of("a.py::t1", "b.py::t2"), config.selection());
    assertEquals(Optional.of(Path.of("run.log")), config.input());
  }

  @Test
  void explicitRootPathWinsOverWorkDir() {
    PulseConfig config = PulseConfig.fromMap(Map.of("workDir", "/srv/project", "rootPath", "/srv/project/../other"));

    assertEquals(Path.of("/srv/other"), config.rootPath());
  }

  @Test
  void blankValuesFallBackToDefaults() {
    PulseConfig config = PulseConfig.fromMap(Map.of("chunkSize", " ", "sentinel", "", "stdSymbols", ""));

    assertEquals(PulseConfig.DEFAULT_CHUNK_SIZE, config.chunkSize());
    assertEquals(FrameFormat.DEFAULT_SENTINEL, config.sentinel());
    assertTrue(config.command().isEmpty());
  }

  @Test
  void rejectsOutOfRangeChunkSize() {
    assertThrows(IllegalArgumentException.class, () -> PulseConfig.fromMap(Map.of("chunkSize", "16")));
    assertThrows(IllegalArgumentException.class, () -> PulseConfig.fromMap(Map.of("chunkSize", "1000000")));
  }

  @Test
  void rejectsInvalidBooleanAndSentinel() {
    assertThrows(IllegalArgumentException.class, () -> PulseConfig.fromMap(Map.of("stdSymbols", "yes")));
    assertThrows(IllegalArgumentException.class, () -> PulseConfig.fromMap(Map.of("sentinel", "two words")));
  }

  @Test
  void rejectsSelectionEntriesWithWhitespace() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> PulseConfig.fromMap(Map.of("selection", "a.py::t1,b.py::has space")));

    assertTrue(ex.getMessage().contains("b.py::has space"));
  }
}
