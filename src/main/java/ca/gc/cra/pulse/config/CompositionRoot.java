package ca.gc.cra.pulse.config;

import ca.gc.cra.pulse.application.control.RunController;
import ca.gc.cra.pulse.application.dispatch.MessageDispatcher;
import ca.gc.cra.pulse.application.emit.PipeEmitter;
import ca.gc.cra.pulse.application.pipeline.TestRunSession;
import ca.gc.cra.pulse.application.port.ClockPort;
import ca.gc.cra.pulse.application.port.MetricsPort;
import ca.gc.cra.pulse.application.port.PayloadCodec;
import ca.gc.cra.pulse.application.port.RunEventHandler;
import ca.gc.cra.pulse.application.port.TestEngineLauncher;
import ca.gc.cra.pulse.application.progress.ProgressGrouper;
import ca.gc.cra.pulse.application.state.TestStateAggregator;
import ca.gc.cra.pulse.domain.protocol.FrameFormat;
import ca.gc.cra.pulse.domain.state.IndicatorStyle;
import ca.gc.cra.pulse.infrastructure.codec.JacksonPayloadCodec;
import ca.gc.cra.pulse.infrastructure.engine.DemoEngine;
import ca.gc.cra.pulse.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.pulse.infrastructure.process.ProcessTestEngineLauncher;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * <strong>What:</strong> Central composition root that wires PULSE use cases to concrete adapters.
 * <p><strong>Why:</strong> Translates one {@link PulseConfig} into runnable object graphs; nothing else in the
 * process reads configuration.</p>
 * <p><strong>Role:</strong> Adapter composition root for the consumer stack (codec, dispatcher, run
 * controller, session) and the emitter side (pipe emitter, demo engine).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the metrics adapter from the configured exporter.</li>
 *   <li>Give each consumer run its own codec, so the decode root path is per run.</li>
 *   <li>Register the run controller ahead of caller-supplied handlers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Factory methods create new instances and are not synchronized.</p>
 * <p><strong>Observability:</strong> Owns the metrics adapter; {@link #close()} flushes it.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final PulseConfig config;
  private final MetricsPort metrics;

  /**
   * Creates a root whose metrics adapter follows {@code metricsExporter}.
   *
   * @param config effective configuration
   * @param metricsExporter {@code otlp} or {@code none}
   */
  public CompositionRoot(PulseConfig config, String metricsExporter) {
    this(config, createMetrics(metricsExporter));
  }

  /**
   * Creates a root with an explicit metrics adapter.
   *
   * @param config effective configuration
   * @param metrics metrics adapter
   */
  public CompositionRoot(PulseConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  private static MetricsPort createMetrics(String exporter) {
    String normalized = exporter == null ? "none" : exporter.trim().toLowerCase(Locale.ROOT);
    return normalized.equals("otlp") ? new OpenTelemetryMetricsAdapter() : MetricsPort.NO_OP;
  }

  public PulseConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /** Launches the engine command as a child process. */
  public TestEngineLauncher engineLauncher() {
    return new ProcessTestEngineLauncher(config.mergeStderr());
  }

  /**
   * Builds a fresh consumer stack.
   *
   * @param extraHandlers builds the handlers notified after the run controller, such as console
   *     printers; receives the controller so they can read the aggregated state
   * @return wired stack
   */
  public ConsumerStack consumerStack(Function<RunController, List<RunEventHandler>> extraHandlers) {
    PayloadCodec codec = new JacksonPayloadCodec(metrics);
    MessageDispatcher dispatcher = new MessageDispatcher(config.frameFormat(), codec, metrics);
    RunController controller = new RunController(new TestStateAggregator(), new ProgressGrouper(),
        ClockPort.SYSTEM, IndicatorStyle.of(config.stdSymbols()), config.surfaceWidth(),
        config.surfaceHeight());
    dispatcher.addHandler(controller);
    for (RunEventHandler handler : extraHandlers.apply(controller)) {
      dispatcher.addHandler(handler);
    }
    TestRunSession session = new TestRunSession(dispatcher, metrics, config.chunkSize());
    return new ConsumerStack(dispatcher, controller, session);
  }

  /**
   * Builds a demo engine writing to this process's standard output.
   *
   * @param demo demo settings
   * @return engine driving a new {@link PipeEmitter}
   */
  public DemoEngine demoEngine(DemoEngineConfig demo) {
    PipeEmitter emitter = PipeEmitter.forStandardOutput(new FrameFormat(demo.sentinel()),
        new JacksonPayloadCodec(metrics), metrics);
    return new DemoEngine(emitter, demo.rootPath(), demo.modules(), demo.testsPerModule(), demo.workers(),
        demo.seed(), demo.delayMillis());
  }

  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }

  /**
   * Consumer-side object graph for one run.
   *
   * @param dispatcher message dispatcher
   * @param controller run controller holding the aggregated state
   * @param session session consuming the engine output
   */
  public record ConsumerStack(MessageDispatcher dispatcher, RunController controller, TestRunSession session) {}
}
