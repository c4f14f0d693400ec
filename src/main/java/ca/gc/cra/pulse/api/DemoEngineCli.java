package ca.gc.cra.pulse.api;

import ca.gc.cra.pulse.config.CompositionRoot;
import ca.gc.cra.pulse.config.ConfigMerger;
import ca.gc.cra.pulse.config.DefaultsForMode;
import ca.gc.cra.pulse.config.DemoEngineConfig;
import ca.gc.cra.pulse.config.PulseConfig;
import ca.gc.cra.pulse.infrastructure.engine.DemoEngine;
import ca.gc.cra.pulse.logging.LoggingConfigurator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the synthetic engine: writes a complete framed run to standard output.
 *
 * <p>Typical use is as the child of {@code run}:
 * {@code pulse run -- java -jar pulse.jar demo-engine workers=4}.</p>
 *
 * @since 0.1.0
 */
public final class DemoEngineCli {
  private static final Logger log = LoggerFactory.getLogger(DemoEngineCli.class);
  private static final String SUMMARY_USAGE =
      "usage: demo-engine [modules=N] [testsPerModule=N] [workers=N] [seed=N] [delayMillis=N] "
          + "[rootPath=PATH] [sentinel=TOKEN] [selection=ID,...]";
  private static final String HELP_TEXT = """
      PULSE demo engine: emits a synthetic framed test run on stdout

      Usage:
        demo-engine [options]

      Optional:
        modules=N                Number of test modules (default 4)
        testsPerModule=N         Tests per module (default 25)
        workers=N                Simulated parallel workers; above 1 collects on a side thread
        seed=N                   Outcome seed (default 12345)
        delayMillis=N            Pause inside each test (default 0)
        rootPath=PATH            Root directory reported to the consumer
        sentinel=TOKEN           Frame sentinel
        selection=ID,...         Run only these node ids; defaults to $PULSE_SELECTION
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private DemoEngineCli() {}

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
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    DemoEngineConfig demo;
    Set<String> selection;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap("demo-engine", input.keyValueArgs()));
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          "demo-engine", Optional.empty(), kv, DefaultsForMode.asFlatMap("demo-engine"), log::warn);
      demo = DemoEngineConfig.fromMap(effective);
      String rawSelection = effective.getOrDefault("selection", "");
      if (rawSelection.isBlank()) {
        rawSelection = Optional.ofNullable(System.getenv(ConsumerCliSupport.SELECTION_ENV)).orElse("");
      }
      selection = parseSelection(rawSelection);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid demo-engine arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(PulseConfig.defaults(), "none")) {
      DemoEngine engine = root.demoEngine(demo);
      int status = engine.run(selection);
      return status == 0 ? ExitCode.SUCCESS : ExitCode.TESTS_FAILED;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Demo engine interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in demo engine", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static Set<String> parseSelection(String raw) {
    Set<String> ids = new LinkedHashSet<>();
    for (String token : raw.split(",")) {
      if (!token.isBlank()) {
        ids.add(token.trim());
      }
    }
    return ids;
  }
}
