package ca.gc.cra.funnel.api;

import ca.gc.cra.funnel.application.dispatch.ChannelRegistry;
import ca.gc.cra.funnel.application.dispatch.RecordDispatcher;
import ca.gc.cra.funnel.application.dispatch.SinkBinding;
import ca.gc.cra.funnel.application.dispatch.SinkSet;
import ca.gc.cra.funnel.application.lifecycle.LoggingLifecycle;
import ca.gc.cra.funnel.application.mode.ModeResolver;
import ca.gc.cra.funnel.application.pipeline.CollectorLoop;
import ca.gc.cra.funnel.application.port.ChannelHandle;
import ca.gc.cra.funnel.application.port.ClockPort;
import ca.gc.cra.funnel.application.port.MetricsPort;
import ca.gc.cra.funnel.application.port.SendResult;
import ca.gc.cra.funnel.config.LoggingConfig;
import ca.gc.cra.funnel.config.LoggingConfigLoader;
import ca.gc.cra.funnel.config.QueueSettings;
import ca.gc.cra.funnel.config.SinkSpec;
import ca.gc.cra.funnel.domain.log.LogRecord;
import ca.gc.cra.funnel.domain.log.OperatingMode;
import ca.gc.cra.funnel.domain.log.Severity;
import ca.gc.cra.funnel.domain.log.SourceLocation;
import ca.gc.cra.funnel.infrastructure.channel.PipedRecordReader;
import ca.gc.cra.funnel.infrastructure.channel.QueueRecordChannel;
import ca.gc.cra.funnel.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.funnel.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.funnel.infrastructure.sink.SinkConstructionException;
import ca.gc.cra.funnel.infrastructure.sink.SinkFactory;
import ca.gc.cra.funnel.util.PathUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Entry point that hands out {@link Channel}s and routes their records according to the
 * process topology.
 * <p><strong>Modes:</strong>
 * <ul>
 *   <li>{@link OperatingMode#STANDALONE}: records are formatted and written on the caller thread.</li>
 *   <li>{@link OperatingMode#AGGREGATION_OWNER}: records from this facade and from every worker go through one
 *   channel; a collector thread is the only writer of the sinks.</li>
 *   <li>{@link OperatingMode#WORKER}: records are filtered locally and sent to the owner's channel; no sinks are
 *   opened.</li>
 * </ul>
 * The mode is resolved once at construction and never changes.</p>
 * <p><strong>Failures:</strong> Configuration errors throw {@link ca.gc.cra.funnel.config.ConfigParseException}
 * from the constructor. A sink that cannot be built is logged, listed by {@link #sinkFailures()}, and skipped.
 * Emitting never throws because of sink or channel state.</p>
 * <p><strong>Cleanup:</strong> {@link #stop()} is idempotent and {@link #close()} delegates to it, so the facade
 * works in try-with-resources.</p>
 * <p><strong>Thread-safety:</strong> All methods are safe for concurrent use.</p>
 *
 * <pre>{@code
 * try (LoggerFacade owner = new LoggerFacade(Path.of("logging.yaml"), true)) {
 *   ChannelHandle handle = owner.workerHandle().orElseThrow();
 *   executor.submit(() -> {
 *     LoggerFacade worker = new LoggerFacade(Path.of("logging.yaml"), handle);
 *     worker.getChannel("jobs").info("processed {} items", 42);
 *   });
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class LoggerFacade implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LoggerFacade.class);

  private final LoggingConfig config;
  private final OperatingMode mode;
  private final ChannelRegistry registry;
  private final RecordDispatcher dispatcher;
  private final ChannelHandle handle;
  private final QueueRecordChannel ownedChannel;
  private final LoggingLifecycle lifecycle;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final long processId;
  private final String processName;
  private final List<SinkConstructionException> sinkFailures;
  private final ConcurrentMap<String, Channel> channels = new ConcurrentHashMap<>();
  private final List<PipedRecordReader> pipes = new CopyOnWriteArrayList<>();
  private final Object pipeLock = new Object();
  private ExecutorService pipeExecutor;

  /**
   * Loads {@code configPath} and starts a standalone or aggregation-owner facade.
   *
   * @param configPath YAML or JSON configuration file
   * @param useMultiprocess {@code true} to create a channel and collector
   * @throws ca.gc.cra.funnel.config.ConfigParseException if the configuration is missing or invalid
   */
  public LoggerFacade(Path configPath, boolean useMultiprocess) {
    this(configPath, useMultiprocess, FacadeOptions.CONFIGURED_CAPACITY);
  }

  /**
   * @param configPath YAML or JSON configuration file
   * @param useMultiprocess {@code true} to create a channel and collector
   * @param queueCapacity channel capacity; {@code -1} uses {@code queue.size}, {@code 0} means unbounded
   */
  public LoggerFacade(Path configPath, boolean useMultiprocess, int queueCapacity) {
    this(configPath, useMultiprocess, queueCapacity, null);
  }

  /**
   * @param configPath YAML or JSON configuration file
   * @param useMultiprocess {@code true} to aggregate across producers
   * @param queueCapacity channel capacity; {@code -1} uses {@code queue.size}, {@code 0} means unbounded
   * @param channel owner's handle; when present with {@code useMultiprocess} the facade becomes a worker
   */
  public LoggerFacade(Path configPath, boolean useMultiprocess, int queueCapacity, ChannelHandle channel) {
    this(LoggingConfigLoader.load(configPath),
        new FacadeOptions(useMultiprocess, queueCapacity, channel, true, ClockPort.SYSTEM, null, null));
  }

  /**
   * Starts a worker forwarding to {@code channel}.
   *
   * @param configPath configuration supplying channel levels
   * @param channel handle from the owner's {@link #workerHandle()}
   * @throws IllegalArgumentException if {@code channel} is {@code null}
   */
  public LoggerFacade(Path configPath, ChannelHandle channel) {
    this(loadForWorker(configPath, channel), FacadeOptions.worker(channel));
  }

  /**
   * Starts a facade from an already built configuration.
   *
   * @param config logging configuration
   * @param options mode selection and collaborators
   */
  public LoggerFacade(LoggingConfig config, FacadeOptions options) {
    this.config = Objects.requireNonNull(config, "config");
    Objects.requireNonNull(options, "options");
    this.mode = ModeResolver.resolve(options.useMultiprocess(), Optional.ofNullable(options.channel()));
    if (mode == OperatingMode.STANDALONE && options.channel() != null) {
      log.debug("Ignoring supplied channel handle because multiprocess logging was not requested");
    }
    this.clock = options.clock();
    this.processId = ProcessHandle.current().pid();
    this.processName = options.processName();
    boolean ownsMetrics = options.metrics() == null;
    this.metrics = ownsMetrics ? OpenTelemetryMetricsAdapter.create(config.metrics()) : options.metrics();

    List<SinkConstructionException> failures = new ArrayList<>();
    SinkSet sinks = mode.ownsSinks()
        ? buildSinks(config, new SinkFactory(clock, ZoneId.systemDefault(), () -> System.out, () -> System.err),
            failures)
        : SinkSet.empty();
    this.sinkFailures = List.copyOf(failures);
    this.registry = new ChannelRegistry(config, sinks);
    this.dispatcher = new RecordDispatcher(registry, metrics);

    switch (mode) {
      case STANDALONE -> {
        this.ownedChannel = null;
        this.handle = null;
        this.lifecycle = new LoggingLifecycle(mode, sinks, null, options.registerShutdownHook());
      }
      case AGGREGATION_OWNER -> {
        QueueSettings queue = queueSettings(config.queue(), options.queueCapacity());
        this.ownedChannel = QueueRecordChannel.from(queue, metrics);
        this.handle = ownedChannel.producerHandle();
        CollectorLoop collector =
            new CollectorLoop(ownedChannel, dispatcher, sinks, metrics, queue.shutdownTimeout());
        this.lifecycle = new LoggingLifecycle(mode, sinks, collector, options.registerShutdownHook());
      }
      default -> {
        this.ownedChannel = null;
        this.handle = options.channel();
        this.lifecycle = new LoggingLifecycle(mode, sinks, null, false);
      }
    }
    lifecycle.onBeforeDrain(this::stopPipes);
    if (ownsMetrics) {
      lifecycle.onStopped(() -> OpenTelemetryMetricsAdapter.closeQuietly(metrics));
    }
    lifecycle.start();
    log.debug("Started {} with {} sinks ({} failed)", this, sinks.size(), sinkFailures.size());
  }

  private static LoggingConfig loadForWorker(Path configPath, ChannelHandle channel) {
    if (channel == null) {
      throw new IllegalArgumentException("Worker mode requires a channel handle from the aggregation owner");
    }
    return LoggingConfigLoader.load(configPath);
  }

  private SinkSet buildSinks(LoggingConfig config, SinkFactory factory, List<SinkConstructionException> failures) {
    List<SinkBinding> bindings = new ArrayList<>();
    for (SinkSpec spec : config.sinks()) {
      try {
        bindings.add(factory.bind(spec));
      } catch (SinkConstructionException ex) {
        failures.add(ex);
        metrics.increment("funnel.sink.build.error");
        log.error("Failed to build sink {}: {}", spec.name(), ex.getMessage());
      }
    }
    return new SinkSet(bindings);
  }

  private static QueueSettings queueSettings(QueueSettings configured, int requestedCapacity) {
    if (requestedCapacity == FacadeOptions.CONFIGURED_CAPACITY) {
      return configured;
    }
    return configured.withCapacity(requestedCapacity == 0 ? QueueSettings.UNBOUNDED : requestedCapacity);
  }

  /**
   * Returns the channel {@code name}, inheriting its level from ancestors unless configured.
   *
   * @param name dotted channel name; {@code null} or blank selects the root
   * @return channel
   */
  public Channel getChannel(String name) {
    return getChannel(name, null);
  }

  /**
   * Returns the channel {@code name}, using {@code defaultLevel} only when the configuration sets no level for
   * the channel, its ancestors, or the root.
   *
   * @param name dotted channel name; {@code null} or blank selects the root
   * @param defaultLevel fallback level; {@code null} leaves the level unchanged
   * @return channel
   */
  public Channel getChannel(String name, Severity defaultLevel) {
    String canonical = registry.attach(name, defaultLevel);
    return channels.computeIfAbsent(canonical, key -> new Channel(this, key));
  }

  /**
   * Submits a record from {@code channelName}.
   *
   * <p>Records below the channel's effective level are discarded before anything is built. After
   * {@link #stop()} records are discarded and counted.</p>
   *
   * @param channelName canonical channel name
   * @param severity record severity
   * @param message rendered message
   * @param location call site; {@code null} when unknown
   */
  public void emit(String channelName, Severity severity, String message, SourceLocation location) {
    emit(channelName, severity, message, location, null);
  }

  /**
   * Submits a record with an attached throwable rendered as a stack trace.
   *
   * @param channelName canonical channel name
   * @param severity record severity
   * @param message rendered message
   * @param location call site; {@code null} when unknown
   * @param thrown failure to render; may be {@code null}
   */
  public void emit(String channelName, Severity severity, String message, SourceLocation location,
      Throwable thrown) {
    String name = ChannelRegistry.normalize(channelName);
    Objects.requireNonNull(severity, "severity");
    if (lifecycle.isStopped()) {
      metrics.increment("funnel.emit.after.stop");
      log.debug("Discarding {} record on channel {} after stop", severity, name);
      return;
    }
    if (!registry.isEnabled(name, severity)) {
      return;
    }
    LogRecord record = new LogRecord(clock.nowMillis(), name, severity, message, location,
        Thread.currentThread().getName(), processId, processName, render(thrown));
    if (mode == OperatingMode.STANDALONE) {
      try {
        dispatcher.dispatch(record);
      } catch (RuntimeException ex) {
        log.warn("Failed to write record from channel {}", name, ex);
      }
      return;
    }
    SendResult result = handle.send(record);
    if (!result.accepted()) {
      log.debug("Record on channel {} not delivered: {}", name, result);
    }
  }

  private static String render(Throwable thrown) {
    if (thrown == null) {
      return null;
    }
    StringWriter trace = new StringWriter();
    try (PrintWriter writer = new PrintWriter(trace)) {
      thrown.printStackTrace(writer);
    }
    return trace.toString().stripTrailing();
  }

  boolean isEnabled(String channelName, Severity severity) {
    return registry.isEnabled(channelName, severity);
  }

  Severity effectiveLevel(String channelName) {
    return registry.effectiveLevel(channelName);
  }

  /**
   * Reads JSON-line records from {@code in} on a background thread and feeds them into this owner's channel.
   *
   * <p>Use it for child JVMs that log through {@link ca.gc.cra.funnel.infrastructure.channel.PipedRecordWriter}.
   * The reader ends at end of stream; {@link #stop()} waits for it before draining the collector.</p>
   *
   * @param label name used in diagnostics
   * @param in stream carrying the child's records; owned by the reader
   * @return the running reader
   * @throws IllegalStateException if this facade is not an aggregation owner or is stopped
   */
  public PipedRecordReader attachPipe(String label, InputStream in) {
    if (mode != OperatingMode.AGGREGATION_OWNER) {
      throw new IllegalStateException("Pipes can only be attached to an aggregation owner (mode " + mode + ")");
    }
    synchronized (pipeLock) {
      if (lifecycle.isStopped()) {
        throw new IllegalStateException("Logger facade is stopped");
      }
      if (pipeExecutor == null) {
        pipeExecutor = ExecutorFactories.newPipeReaderPool("funnel-pipe",
            (thread, ex) -> log.error("Pipe reader {} terminated unexpectedly", thread.getName(), ex));
      }
      PipedRecordReader reader = new PipedRecordReader(label, in, handle);
      pipes.add(reader);
      pipeExecutor.execute(reader);
      return reader;
    }
  }

  private void stopPipes() {
    ExecutorService executor;
    synchronized (pipeLock) {
      executor = pipeExecutor;
    }
    if (executor == null) {
      return;
    }
    executor.shutdown();
    long timeoutMs = config.queue().shutdownTimeout().toMillis();
    try {
      if (!executor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
        log.warn("Pipe readers still open after {} ms; closing their streams", timeoutMs);
        for (PipedRecordReader reader : pipes) {
          try {
            reader.close();
          } catch (IOException ex) {
            log.debug("Failed to close pipe {}", reader.label(), ex);
          }
        }
        executor.shutdownNow();
        executor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException ie) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Returns the handle workers use to reach this facade's collector.
   *
   * @return the owner's send-only handle, the worker's supplied handle, or empty in standalone mode
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Workers must share the owner's live channel handle.")
  public Optional<ChannelHandle> workerHandle() {
    return Optional.ofNullable(handle);
  }

  public OperatingMode mode() {
    return mode;
  }

  public LoggingConfig config() {
    return config;
  }

  /**
   * Lists the sinks that could not be built at construction.
   *
   * @return failures in configuration order
   */
  public List<SinkConstructionException> sinkFailures() {
    return sinkFailures;
  }

  /**
   * Stops the pipeline: pipe readers finish, the channel closes, the backlog is written, and every sink is
   * closed. Safe to call repeatedly; only the first call has an effect.
   */
  public void stop() {
    if (lifecycle.stop()) {
      log.debug("Stopped {}", this);
    }
  }

  public boolean isStopped() {
    return lifecycle.isStopped();
  }

  /** Same as {@link #stop()}. */
  @Override
  public void close() {
    stop();
  }

  @Override
  public String toString() {
    String source = config.sourcePath().flatMap(PathUtils::fileName).orElse("<programmatic>");
    return "LoggerFacade(mode=" + mode + ", config=" + source + ")";
  }
}
