package ca.gc.cra.pulse.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter out;

  @BeforeEach
  void captureOutput() {
    out = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(out, true));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(out.toString().contains("usage: pulse <run|replay|demo-engine>"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(out.toString().contains("demo-engine"));
  }

  @Test
  void subcommandHelpIsDelegated() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"run", "--help"}));
    assertTrue(out.toString().contains("PULSE run: launch a test engine"));
  }

  @Test
  void runWithoutCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"run", "chunkSize=128"}));
    assertTrue(out.toString().contains("usage: run"));
  }

  @Test
  void misspeltOptionIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"replay", "inptu=run.wire"}));
    assertTrue(out.toString().contains("usage: replay"));
  }

  @Test
  void runRejectsCommandGivenTwice() {
    assertEquals(ExitCode.INVALID_ARGS, RunCli.run(new String[] {"command=engine", "--", "engine"}));
  }

  @Test
  void demoEngineRejectsBadWorkerCount() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"demo-engine", "workers=0"}));
  }
}
