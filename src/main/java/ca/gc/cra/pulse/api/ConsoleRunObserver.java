package ca.gc.cra.pulse.api;

import ca.gc.cra.pulse.application.control.RunController;
import ca.gc.cra.pulse.application.port.RunEventHandler;
import ca.gc.cra.pulse.application.state.TestRecord;
import ca.gc.cra.pulse.domain.protocol.MessageKind;
import ca.gc.cra.pulse.domain.repr.NodeId;
import ca.gc.cra.pulse.domain.state.IndicatorStyle;
import ca.gc.cra.pulse.domain.state.TestStatus;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Prints engine passthrough, forwarded terminal output and per-test failures to the console.
 *
 * <p>Registered after the {@link RunController}, so the state it reads already reflects the message
 * being delivered.</p>
 *
 * @since 0.1.0
 */
final class ConsoleRunObserver implements RunEventHandler {
  private static final Set<MessageKind> SUBSCRIPTIONS = EnumSet.of(
      MessageKind.WRITE, MessageKind.WRITE_LINE, MessageKind.WRITE_SEP, MessageKind.REWRITE,
      MessageKind.COPY_STDOUT, MessageKind.COPY_STDERR, MessageKind.COLLECTION_FINISH,
      MessageKind.END_TEST, MessageKind.INTERNAL_ERROR);
  private static final Set<TestStatus> REPORTED = EnumSet.of(
      TestStatus.FAILED, TestStatus.SETUP_ERRORED, TestStatus.TEARDOWN_ERRORED, TestStatus.XPASSED);

  private final RunController controller;
  private final IndicatorStyle style;
  private final int width;

  ConsoleRunObserver(RunController controller, IndicatorStyle style, int width) {
    this.controller = Objects.requireNonNull(controller, "controller");
    this.style = Objects.requireNonNull(style, "style");
    this.width = width;
  }

  @Override
  public Set<MessageKind> subscriptions() {
    return SUBSCRIPTIONS;
  }

  @Override
  public void onOutputLine(String line) {
    CliPrinter.println(line);
  }

  @Override
  public void onWrite(String text) {
    CliPrinter.print(text);
  }

  @Override
  public void onWriteLine(String line) {
    CliPrinter.println(line);
  }

  @Override
  public void onWriteSep(String sep, String title) {
    CliPrinter.println(separatorLine(sep, title, width));
  }

  @Override
  public void onRewrite(String line) {
    CliPrinter.print("\r" + line);
  }

  @Override
  public void onCopyStdout(String text) {
    CliPrinter.print(text);
  }

  @Override
  public void onCopyStderr(String text) {
    CliPrinter.print(text);
  }

  @Override
  public void onCollectionFinish() {
    CliPrinter.println(controller.collectionProgress());
  }

  @Override
  public void onEndTest(NodeId nodeId) {
    Optional<TestRecord> record = controller.state().lookup(nodeId);
    if (record.isPresent() && REPORTED.contains(record.get().status())) {
      TestRecord test = record.get();
      CliPrinter.println(test.indicator(style) + " " + test.status() + " " + nodeId);
    }
  }

  @Override
  public void onInternalError(String text) {
    CliPrinter.println("INTERNAL ERROR: " + text);
  }

  /**
   * Centres {@code title} in a line of {@code sep} characters.
   *
   * @param sep fill character sequence; blank falls back to {@code "-"}
   * @param title title text; may be empty
   * @param width line width
   * @return separator line
   */
  static String separatorLine(String sep, String title, int width) {
    String fill = sep == null || sep.isBlank() ? "-" : sep;
    if (title == null || title.isEmpty()) {
      return fill.repeat(Math.max(1, width / fill.length()));
    }
    String middle = " " + title + " ";
    int remaining = Math.max(2, width - middle.length());
    int left = remaining / 2;
    int right = remaining - left;
    return fill.repeat(Math.max(1, left / fill.length())) + middle
        + fill.repeat(Math.max(1, right / fill.length()));
  }
}
