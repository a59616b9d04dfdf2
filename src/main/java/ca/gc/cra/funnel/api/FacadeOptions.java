package ca.gc.cra.funnel.api;

import ca.gc.cra.funnel.application.port.ChannelHandle;
import ca.gc.cra.funnel.application.port.ClockPort;
import ca.gc.cra.funnel.application.port.MetricsPort;
import java.util.Objects;

/**
 * Construction options for {@link LoggerFacade}.
 *
 * @param useMultiprocess request cross-producer aggregation instead of standalone writing
 * @param queueCapacity channel capacity for an aggregation owner; {@code -1} uses {@code queue.size} from the
 *     configuration, {@code 0} means unbounded
 * @param channel handle supplied by an aggregation owner; present only for workers
 * @param registerShutdownHook stop automatically at JVM exit (owner and standalone only)
 * @param clock time source for record timestamps and time-based rotation
 * @param metrics metrics port overriding the configured exporter; {@code null} uses the configuration
 * @param processName label rendered by {@code %(processName)s}
 * @since 0.1.0
 */
public record FacadeOptions(
    boolean useMultiprocess,
    int queueCapacity,
    ChannelHandle channel,
    boolean registerShutdownHook,
    ClockPort clock,
    MetricsPort metrics,
    String processName) {

  /** Queue capacity meaning "take {@code queue.size} from the configuration". */
  public static final int CONFIGURED_CAPACITY = -1;
  /** Default process label. */
  public static final String DEFAULT_PROCESS_NAME = "MainProcess";

  public FacadeOptions {
    if (queueCapacity < CONFIGURED_CAPACITY) {
      throw new IllegalArgumentException("queueCapacity must be -1, 0, or positive (was " + queueCapacity + ")");
    }
    clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
    processName = processName == null || processName.isBlank() ? DEFAULT_PROCESS_NAME : processName;
  }

  /** Single-process options: sinks written on the caller thread. */
  public static FacadeOptions standalone() {
    return new FacadeOptions(false, CONFIGURED_CAPACITY, null, true, ClockPort.SYSTEM, null, null);
  }

  /** Aggregation-owner options: a channel and collector are created. */
  public static FacadeOptions aggregationOwner() {
    return new FacadeOptions(true, CONFIGURED_CAPACITY, null, true, ClockPort.SYSTEM, null, null);
  }

  /**
   * Worker options forwarding records to {@code channel}.
   *
   * @param channel handle obtained from the owner's {@link LoggerFacade#workerHandle()}
   * @return worker options
   * @throws IllegalArgumentException if {@code channel} is {@code null}
   */
  public static FacadeOptions worker(ChannelHandle channel) {
    if (channel == null) {
      throw new IllegalArgumentException("Worker mode requires a channel handle from the aggregation owner");
    }
    return new FacadeOptions(true, CONFIGURED_CAPACITY, channel, false, ClockPort.SYSTEM, null, null);
  }

  public FacadeOptions withQueueCapacity(int capacity) {
    return new FacadeOptions(useMultiprocess, capacity, channel, registerShutdownHook, clock, metrics, processName);
  }

  public FacadeOptions withShutdownHook(boolean register) {
    return new FacadeOptions(useMultiprocess, queueCapacity, channel, register, clock, metrics, processName);
  }

  public FacadeOptions withMetrics(MetricsPort newMetrics) {
    return new FacadeOptions(useMultiprocess, queueCapacity, channel, registerShutdownHook, clock, newMetrics,
        processName);
  }

  public FacadeOptions withProcessName(String name) {
    return new FacadeOptions(useMultiprocess, queueCapacity, channel, registerShutdownHook, clock, metrics, name);
  }
}
