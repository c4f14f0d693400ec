package ca.gc.cra.pulse.application.port;

import java.io.InputStream;
import java.util.concurrent.TimeUnit;

/**
 * Running source of engine output: a child process, or a recorded stream being replayed.
 *
 * @since 0.1.0
 */
public interface EngineProcess {
  /** Combined output channel of the engine. */
  InputStream output();

  /**
   * Waits for the engine to terminate.
   *
   * @return exit status
   * @throws InterruptedException if the waiting thread is interrupted
   */
  int waitFor() throws InterruptedException;

  /**
   * Waits at most {@code timeout} for the engine to terminate.
   *
   * @param timeout maximum wait
   * @param unit unit of {@code timeout}
   * @return {@code true} when the engine has exited
   * @throws InterruptedException if the waiting thread is interrupted
   */
  boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException;

  /** Terminates the engine; closes {@link #output()} so pending reads end. */
  void destroy();

  /** Short description for logs, such as the command line or file name. */
  String describe();
}
