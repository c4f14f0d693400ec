package ca.gc.cra.pulse.support;

import ca.gc.cra.pulse.application.port.EngineProcess;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Engine process double that replays canned output and reports a fixed exit code. A lingering
 * process only exits once destroyed.
 */
public final class ScriptedEngineProcess implements EngineProcess {
  private final InputStream output;
  private final int exitCode;
  private final boolean lingers;
  private volatile boolean destroyed;

  public ScriptedEngineProcess(String output, int exitCode) {
    this(new ByteArrayInputStream(output.getBytes(StandardCharsets.UTF_8)), exitCode);
  }

  public ScriptedEngineProcess(InputStream output, int exitCode) {
    this(output, exitCode, false);
  }

  public ScriptedEngineProcess(InputStream output, int exitCode, boolean lingers) {
    this.output = output;
    this.exitCode = exitCode;
    this.lingers = lingers;
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
    return !lingers || destroyed;
  }

  @Override
  public void destroy() {
    destroyed = true;
  }

  @Override
  public String describe() {
    return "scripted engine";
  }

  public boolean destroyed() {
    return destroyed;
  }
}
