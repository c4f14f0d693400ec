package ca.gc.cra.pulse.domain.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class RunResultTest {

  @Test
  void passingAndFailingTestsAreCleanExits() {
    assertTrue(RunResult.of(0, true).cleanExit());
    assertTrue(RunResult.of(1, true).cleanExit());
  }

  @Test
  void unexpectedExitStatusIsFailure() {
    RunResult result = RunResult.of(4, true);

    assertFalse(result.cleanExit());
    assertEquals("engine exited with status 4", result.failure().orElseThrow().getMessage());
  }

  @Test
  void missingSessionEndIsFailureEvenWithZeroExit() {
    RunResult result = RunResult.of(0, false);

    assertFalse(result.cleanExit());
    assertEquals("engine stream closed before the session ended (exit 0)",
        result.failure().orElseThrow().getMessage());
  }

  @Test
  void indicatorsFollowStyle() {
    assertEquals("✔", TestStatus.PASSED.indicator(IndicatorStyle.FANCY));
    assertEquals(".", TestStatus.PASSED.indicator(IndicatorStyle.STANDARD));
    assertEquals("setup_errored", TestStatus.SETUP_ERRORED.label());
    assertTrue(TestStatus.TEARDOWN_RUNNING.inProgress());
    assertFalse(TestStatus.INTERRUPTED.inProgress());
  }
}
