package ca.gc.cra.pulse.infrastructure.process;

import ca.gc.cra.pulse.application.port.EngineProcess;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a captured engine output stream as if a live engine had produced it.
 *
 * <p>The recorded run has no exit status of its own; {@link #waitFor()} reports the status given at
 * construction, {@code 0} by default.</p>
 *
 * @since 0.1.0
 */
public final class RecordedEngineProcess implements EngineProcess {
  private static final Logger log = LoggerFactory.getLogger(RecordedEngineProcess.class);

  private final InputStream output;
  private final String description;
  private final int exitCode;

  /**
   * Wraps an already open stream.
   *
   * @param output recorded output; closed by {@link #destroy()}
   * @param description label for logs
   * @param exitCode status returned by {@link #waitFor()}
   */
  public RecordedEngineProcess(InputStream output, String description, int exitCode) {
    this.output = Objects.requireNonNull(output, "output");
    this.description = Objects.requireNonNull(description, "description");
    this.exitCode = exitCode;
  }

  /**
   * Opens a recorded wire file.
   *
   * @param file wire file written by a previous run
   * @return replay process reporting exit status {@code 0}
   * @throws IOException if the file cannot be opened
   */
  public static RecordedEngineProcess open(Path file) throws IOException {
    return new RecordedEngineProcess(Files.newInputStream(file), file.toString(), 0);
  }

  @Override
  public InputStream output() {
    return output;
  }

  @Override
  public int waitFor() {
    return exitCode;
  }

  @Override
  public boolean waitFor(long timeout, TimeUnit unit) {
    return true;
  }

  @Override
  public void destroy() {
    try {
      output.close();
    } catch (IOException ex) {
      log.warn("Failed to close recorded stream {}", description, ex);
    }
  }

  @Override
  public String describe() {
    return "replay of " + description;
  }
}
