package ca.gc.cra.pulse.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pulse.domain.protocol.FrameFormat;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void runDefaultsCarryConsumerAndLauncherKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("RUN");

    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals(FrameFormat.DEFAULT_SENTINEL, defaults.get("sentinel"));
    assertEquals("1024", defaults.get("chunkSize"));
    assertEquals("true", defaults.get("mergeStderr"));
    assertEquals("", defaults.get("command"));
    assertFalse(defaults.containsKey("input"));
  }

  @Test
  void replayDefaultsHaveInputButNoCommand() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("replay");

    assertTrue(defaults.containsKey("input"));
    assertFalse(defaults.containsKey("command"));
    assertEquals("true", defaults.get("timings"));
  }

  @Test
  void demoDefaultsDescribeTheSuite() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("demo-engine");

    assertEquals("4", defaults.get("modules"));
    assertEquals("25", defaults.get("testsPerModule"));
    assertFalse(defaults.containsKey("chunkSize"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
