package ca.gc.cra.pulse.api;

import ca.gc.cra.pulse.application.control.RunController;
import ca.gc.cra.pulse.domain.state.RunResult;
import ca.gc.cra.pulse.infrastructure.process.RecordedEngineProcess;
import java.nio.file.Path;

/**
 * Entry point that feeds a recorded engine output file through the consumer stack.
 *
 * <p>Useful for reproducing rendering problems: capture a run with
 * {@code demo-engine > run.wire} (or any engine's stdout) and replay it.</p>
 *
 * @since 0.1.0
 */
public final class ReplayCli {
  private static final String SUMMARY_USAGE =
      "usage: replay input=PATH [rootPath=PATH] [chunkSize=N] [sentinel=TOKEN] [surfaceWidth=N] "
          + "[surfaceHeight=N] [stdSymbols=true|false] [config=PATH] [--no-timings]";
  private static final String HELP_TEXT = """
      PULSE replay: report a recorded engine run

      Usage:
        replay input=./run.wire [options]

      Required:
        input=PATH               Recorded engine output (passthrough text and frames)

      Optional:
        rootPath=PATH            Root used to shorten node id paths
        chunkSize=N              Read size in bytes, 64..65536 (default 1024)
        sentinel=TOKEN           Frame sentinel used when the file was recorded
        surfaceWidth=N           Columns used for progress grouping (default 80)
        surfaceHeight=N          Rows used for progress grouping (default 24)
        stdSymbols=true|false    Plain ASCII status indicators (default false)
        config=PATH              YAML file with common/replay sections
        --no-timings             Omit phase timings from the summary
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private ReplayCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return ConsumerCliSupport.execute("replay", args, SUMMARY_USAGE, HELP_TEXT,
        (root, stack, selection, timings) -> {
          Path input = root.config().input()
              .orElseThrow(() -> new IllegalArgumentException("input is required for replay"));
          RunController controller = stack.controller();
          controller.startRun(selection);
          RecordedEngineProcess process = RecordedEngineProcess.open(input);
          RunResult result;
          try {
            result = stack.session().run(process);
          } finally {
            process.destroy();
          }
          ConsumerCliSupport.printSummary(controller, timings);
          return ConsumerCliSupport.exitCodeFor(result, controller);
        });
  }
}
