package ca.gc.cra.pulse.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> Port that starts the test-execution engine as a child process.
 * <p><strong>Role:</strong> Implemented by {@code ProcessTestEngineLauncher}; faked in tests.</p>
 *
 * @since 0.1.0
 */
public interface TestEngineLauncher {
  /**
   * Starts the engine.
   *
   * @param command engine command line
   * @param workDir working directory; {@code null} for the current directory
   * @param environment extra environment variables for the child
   * @return handle on the running engine
   * @throws IOException if the process cannot be started
   */
  EngineProcess launch(List<String> command, Path workDir, Map<String, String> environment)
      throws IOException;
}
