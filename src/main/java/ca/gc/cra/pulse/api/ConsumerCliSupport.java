package ca.gc.cra.pulse.api;

import ca.gc.cra.pulse.application.control.RunController;
import ca.gc.cra.pulse.config.CompositionRoot;
import ca.gc.cra.pulse.config.ConfigMerger;
import ca.gc.cra.pulse.config.DefaultsForMode;
import ca.gc.cra.pulse.config.PulseConfig;
import ca.gc.cra.pulse.config.YamlConfigLoader;
import ca.gc.cra.pulse.domain.repr.NodeId;
import ca.gc.cra.pulse.domain.state.IndicatorStyle;
import ca.gc.cra.pulse.domain.state.RunResult;
import ca.gc.cra.pulse.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared flow for the consumer commands ({@code run}, {@code replay}): argument parsing, config
 * merging, stack wiring, summary printing and exit-code mapping.
 */
final class ConsumerCliSupport {
  private static final Logger log = LoggerFactory.getLogger(ConsumerCliSupport.class);

  /** Environment variable carrying a comma separated node id selection to the engine. */
  static final String SELECTION_ENV = "PULSE_SELECTION";

  private ConsumerCliSupport() {
    // Utility class
  }

  /** One consumer command's work once configuration is settled. */
  @FunctionalInterface
  interface ConsumerAction {
    ExitCode execute(CompositionRoot root, CompositionRoot.ConsumerStack stack, Set<NodeId> selection,
        boolean timings) throws IOException, InterruptedException;
  }

  static ExitCode execute(String mode, String[] args, String usage, String helpText, ConsumerAction action) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(helpText.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} CLI", mode);
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(mode, input.keyValueArgs()));
      if (!input.trailingCommand().isEmpty()) {
        if (kv.containsKey("command")) {
          throw new IllegalArgumentException("give the engine command either as command= or after --");
        }
        kv.put("command", String.join(" ", input.trailingCommand()));
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    PulseConfig config;
    String exporter;
    boolean timings;
    try {
      effective = ConfigMerger.buildEffectiveConfig(mode, yamlConfig, kv, DefaultsForMode.asFlatMap(mode), log::warn);
      timings = !input.hasFlag("--no-timings") && ConfigCliUtils.parseBoolean(effective, "timings", true);
      Map<String, String> configInputs = new LinkedHashMap<>(effective);
      exporter = TelemetryConfigurator.configureMetrics(configInputs);
      config = PulseConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(config, exporter)) {
      CompositionRoot.ConsumerStack stack = buildStack(root);
      Set<NodeId> selection = toNodeIds(config.selection());
      log.info("Configured {}: rootPath={}, chunkSize={}, selection={}, metricsExporter={}",
          mode, config.rootPath(), config.chunkSize(), selection.size(), exporter);
      return action.execute(root, stack, selection, timings);
    } catch (IOException ex) {
      log.error("{} I/O failure: {}", mode, ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("{} interrupted; shutting down", mode, ex);
      return ExitCode.INTERRUPTED;
    } catch (IllegalArgumentException ex) {
      log.error("{} configuration error: {}", mode, ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {}", mode, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static CompositionRoot.ConsumerStack buildStack(CompositionRoot root) {
    PulseConfig config = root.config();
    return root.consumerStack(controller -> List.of(new ConsoleRunObserver(controller,
        IndicatorStyle.of(config.stdSymbols()), config.surfaceWidth())));
  }

  static Set<NodeId> toNodeIds(Set<String> ids) {
    Set<NodeId> nodeIds = new LinkedHashSet<>();
    for (String id : ids) {
      nodeIds.add(NodeId.of(id));
    }
    return nodeIds;
  }

  static void printSummary(RunController controller, boolean timings) {
    CliPrinter.printLines(controller.summary(timings));
    for (String error : controller.internalErrors()) {
      CliPrinter.println("internal error: " + error);
    }
    if (!controller.warnings().isEmpty()) {
      CliPrinter.println(controller.warnings().size() + " warning(s) recorded");
    }
  }

  /**
   * Maps a finished run onto the CLI exit code.
   *
   * @param result classified engine exit
   * @param controller controller that observed the run
   * @return exit code
   */
  static ExitCode exitCodeFor(RunResult result, RunController controller) {
    if (controller.interrupted()) {
      return ExitCode.INTERRUPTED;
    }
    if (!result.cleanExit()) {
      return ExitCode.RUNTIME_FAILURE;
    }
    return result.exitCode() == RunResult.EXIT_OK && controller.failingTests().isEmpty()
        ? ExitCode.SUCCESS
        : ExitCode.TESTS_FAILED;
  }
}
