package ca.gc.cra.pulse.api;

import ca.gc.cra.pulse.application.control.RunController;
import ca.gc.cra.pulse.application.port.TestEngineLauncher;
import ca.gc.cra.pulse.config.PulseConfig;
import ca.gc.cra.pulse.domain.repr.NodeId;
import ca.gc.cra.pulse.domain.state.RunResult;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point that launches the test engine as a child process and reports its run.
 *
 * @since 0.1.0
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final String SUMMARY_USAGE =
      "usage: run [command=CMD] [workDir=PATH] [rootPath=PATH] [selection=ID,...] [chunkSize=N] "
          + "[sentinel=TOKEN] [surfaceWidth=N] [surfaceHeight=N] [stdSymbols=true|false] "
          + "[mergeStderr=true|false] [config=PATH] [--rerun-failed] [--no-timings] -- CMD...";
  private static final String HELP_TEXT = """
      PULSE run: launch a test engine and report its progress

      Usage:
        run [options] -- ENGINE COMMAND...

      Required:
        command=CMD or -- CMD    Engine command line (key form is split on whitespace)

      Optional:
        workDir=PATH             Engine working directory (default current directory)
        rootPath=PATH            Root used to shorten node id paths (default workDir)
        selection=ID,...         Run only these node ids; passed to the engine as PULSE_SELECTION
        chunkSize=N              Read size in bytes, 64..65536 (default 1024)
        sentinel=TOKEN           Frame sentinel; must match the engine side
        surfaceWidth=N           Columns used for progress grouping (default 80)
        surfaceHeight=N          Rows used for progress grouping (default 24)
        stdSymbols=true|false    Plain ASCII status indicators (default false)
        mergeStderr=true|false   Merge engine stderr into the consumed stream (default true)
        config=PATH              YAML file with common/run sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --rerun-failed           Run the failing tests once more after the first run
        --no-timings             Omit phase timings from the summary
        --verbose                Enable DEBUG logging
        --help                   Show this message

      Exit codes: 0 all passed, 1 tests failed, 2 bad arguments, 3 I/O error,
      4 configuration error, 5 engine failure, 130 interrupted.
      """;

  private RunCli() {}

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
    boolean rerunFailed = CliInput.parse(args).hasFlag("--rerun-failed");
    return ConsumerCliSupport.execute("run", args, SUMMARY_USAGE, HELP_TEXT,
        (root, stack, selection, timings) -> {
          RunController controller = stack.controller();
          PulseConfig config = root.config();
          TestEngineLauncher launcher = root.engineLauncher();
          Path workDir = config.workDir().orElse(null);

          controller.startRun(selection);
          RunResult result = stack.session().launchAndRun(launcher, config.command(), workDir,
              environmentFor(selection));
          ExitCode exit = ConsumerCliSupport.exitCodeFor(result, controller);
          if (rerunFailed && exit == ExitCode.TESTS_FAILED) {
            Set<NodeId> failing = new LinkedHashSet<>(controller.failingTests());
            log.info("Rerunning {} failing tests", failing.size());
            controller.startRun(failing);
            result = stack.session().launchAndRun(launcher, config.command(), workDir, environmentFor(failing));
            exit = ConsumerCliSupport.exitCodeFor(result, controller);
          }
          ConsumerCliSupport.printSummary(controller, timings);
          return exit;
        });
  }

  static Map<String, String> environmentFor(Set<NodeId> selection) {
    if (selection.isEmpty()) {
      return Map.of();
    }
    String joined = selection.stream().map(NodeId::value).collect(Collectors.joining(","));
    return Map.of(ConsumerCliSupport.SELECTION_ENV, joined);
  }
}
