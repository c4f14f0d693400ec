package ca.gc.cra.pulse.application.emit;

import ca.gc.cra.pulse.domain.protocol.MessageKind;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Output stream that turns writes to the engine's {@code System.out}/{@code System.err} into
 * {@code copy_stdout}/{@code copy_stderr} messages, one per line or flush.
 *
 * <p>Writes made by the emitter's own writer thread go straight to the original stream so logging from
 * that thread cannot loop back into the queue.</p>
 */
final class PipeRedirectStream extends OutputStream {
  private final PipeEmitter emitter;
  private final MessageKind kind;
  private final OutputStream original;
  private final ByteArrayOutputStream pending = new ByteArrayOutputStream(256);

  PipeRedirectStream(PipeEmitter emitter, MessageKind kind, OutputStream original) {
    this.emitter = Objects.requireNonNull(emitter, "emitter");
    if (kind != MessageKind.COPY_STDOUT && kind != MessageKind.COPY_STDERR) {
      throw new IllegalArgumentException("Not a copy message kind: " + kind);
    }
    this.kind = kind;
    this.original = Objects.requireNonNull(original, "original");
  }

  @Override
  public synchronized void write(int b) throws IOException {
    if (emitter.isWriterThread()) {
      original.write(b);
      return;
    }
    pending.write(b);
    if (b == '\n') {
      drain();
    }
  }

  @Override
  public synchronized void write(byte[] b, int off, int len) throws IOException {
    if (emitter.isWriterThread()) {
      original.write(b, off, len);
      return;
    }
    pending.write(b, off, len);
    if (len > 0 && b[off + len - 1] == '\n') {
      drain();
    }
  }

  @Override
  public synchronized void flush() throws IOException {
    if (emitter.isWriterThread()) {
      original.flush();
      return;
    }
    drain();
  }

  @Override
  public void close() throws IOException {
    flush();
  }

  private void drain() {
    if (pending.size() == 0) {
      return;
    }
    String text = pending.toString(StandardCharsets.UTF_8);
    pending.reset();
    emitter.copy(kind, text);
  }
}
