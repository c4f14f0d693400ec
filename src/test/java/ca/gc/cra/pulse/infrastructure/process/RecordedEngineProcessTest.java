package ca.gc.cra.pulse.infrastructure.process;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RecordedEngineProcessTest {
  @TempDir Path tempDir;

  @Test
  void replaysFileContentWithCleanExit() throws IOException {
    Path wire = tempDir.resolve("run.wire");
    Files.writeString(wire, "line one\n", StandardCharsets.UTF_8);

    RecordedEngineProcess process = RecordedEngineProcess.open(wire);
    try (InputStream in = process.output()) {
      assertEquals("line one\n", new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }
    assertEquals(0, process.waitFor());
    assertEquals("replay of " + wire, process.describe());
    process.destroy();
  }

  @Test
  void destroyClosesTheStream() throws IOException {
    Path wire = tempDir.resolve("run.wire");
    Files.writeString(wire, "x", StandardCharsets.UTF_8);
    RecordedEngineProcess process = RecordedEngineProcess.open(wire);

    process.destroy();

    assertThrows(IOException.class, () -> process.output().read());
  }

  @Test
  void missingFileFails() {
    assertThrows(IOException.class, () -> RecordedEngineProcess.open(tempDir.resolve("absent.wire")));
  }
}
