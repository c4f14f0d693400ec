package ca.gc.cra.pulse.infrastructure.process;

import ca.gc.cra.pulse.application.port.EngineProcess;
import ca.gc.cra.pulse.application.port.TestEngineLauncher;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Starts the test engine with {@link ProcessBuilder}.
 * <p><strong>Role:</strong> Infrastructure adapter behind {@link TestEngineLauncher}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Merge stderr into stdout when requested, so engine diagnostics appear as passthrough lines.</li>
 *   <li>Otherwise inherit stderr so it reaches the operator's terminal directly.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class ProcessTestEngineLauncher implements TestEngineLauncher {
  private static final Logger log = LoggerFactory.getLogger(ProcessTestEngineLauncher.class);

  private final boolean mergeStderr;

  /**
   * Creates a launcher.
   *
   * @param mergeStderr whether stderr is merged into the consumed output channel
   */
  public ProcessTestEngineLauncher(boolean mergeStderr) {
    this.mergeStderr = mergeStderr;
  }

  @Override
  public EngineProcess launch(List<String> command, Path workDir, Map<String, String> environment)
      throws IOException {
    Objects.requireNonNull(command, "command");
    if (command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    ProcessBuilder builder = new ProcessBuilder(command);
    if (workDir != null) {
      builder.directory(workDir.toFile());
    }
    if (environment != null && !environment.isEmpty()) {
      builder.environment().putAll(environment);
    }
    if (mergeStderr) {
      builder.redirectErrorStream(true);
    } else {
      builder.redirectError(ProcessBuilder.Redirect.INHERIT);
    }
    builder.redirectInput(ProcessBuilder.Redirect.INHERIT);
    Process process = builder.start();
    String description = String.join(" ", command);
    log.info("Started engine pid={} command={}", process.pid(), description);
    return new ChildEngineProcess(process, description);
  }

  private static final class ChildEngineProcess implements EngineProcess {
    private final Process process;
    private final String description;

    private ChildEngineProcess(Process process, String description) {
      this.process = process;
      this.description = description;
    }

    @Override
    public InputStream output() {
      return process.getInputStream();
    }

    @Override
    public int waitFor() throws InterruptedException {
      return process.waitFor();
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
      return process.waitFor(timeout, unit);
    }

    @Override
    public void destroy() {
      process.destroy();
      try {
        process.getInputStream().close();
      } catch (IOException ex) {
        log.debug("Closing engine output after destroy failed", ex);
      }
    }

    @Override
    public String describe() {
      return description;
    }
  }
}
