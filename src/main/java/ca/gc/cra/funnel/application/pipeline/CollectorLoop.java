package ca.gc.cra.funnel.application.pipeline;

import ca.gc.cra.funnel.application.dispatch.RecordDispatcher;
import ca.gc.cra.funnel.application.dispatch.SinkSet;
import ca.gc.cra.funnel.application.port.MetricsPort;
import ca.gc.cra.funnel.application.port.RecordChannel;
import ca.gc.cra.funnel.domain.log.LogRecord;
import ca.gc.cra.funnel.domain.log.OperatingMode;
import ca.gc.cra.funnel.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Single consumer that drains a {@link RecordChannel} into the owner's sinks.
 * <p><strong>Why:</strong> In multi-producer topologies this is the only code that writes to sinks, so lines
 * from different producers never interleave within a file.</p>
 * <p><strong>Role:</strong> Started and stopped by {@code LoggingLifecycle} in aggregation-owner mode.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Receive until the channel reports closed and drained, dispatching each record.</li>
 *   <li>Keep running when one record or one sink fails.</li>
 *   <li>Close every sink exactly once on exit.</li>
 * </ul>
 * <p><strong>Shutdown:</strong> {@link #stop()} closes the channel and waits until every queued record is written;
 * the collector is never interrupted over a non-empty channel. Concurrent callers of {@link #stop()} all wait for
 * the same drain.</p>
 * <p><strong>Thread-safety:</strong> {@link #start()} and {@link #stop()} may be called from any thread; state
 * changes are atomic and one-way.</p>
 * <p><strong>Observability:</strong> Emits {@code funnel.collector.dispatched} and
 * {@code funnel.collector.dispatch.error}; the collector thread carries MDC key {@code funnel.mode}.</p>
 *
 * @since 0.1.0
 */
public final class CollectorLoop {
  private static final Logger log = LoggerFactory.getLogger(CollectorLoop.class);
  private static final AtomicInteger IDS = new AtomicInteger();
  static final String MDC_MODE = "funnel.mode";

  private final RecordChannel channel;
  private final RecordDispatcher dispatcher;
  private final SinkSet sinks;
  private final MetricsPort metrics;
  private final Duration shutdownTimeout;
  private final String threadName;
  private final AtomicReference<CollectorState> state = new AtomicReference<>(CollectorState.NOT_STARTED);
  private final AtomicLong dispatched = new AtomicLong();
  private final CountDownLatch finished = new CountDownLatch(1);
  private volatile ExecutorService executor;

  /**
   * @param channel channel to drain; this loop is its only consumer
   * @param dispatcher routes records to sinks
   * @param sinks sinks closed when the loop ends
   * @param metrics metrics sink
   * @param shutdownTimeout interval at which {@link #stop()} reports a backlog that is still draining
   */
  public CollectorLoop(
      RecordChannel channel,
      RecordDispatcher dispatcher,
      SinkSet sinks,
      MetricsPort metrics,
      Duration shutdownTimeout) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.sinks = Objects.requireNonNull(sinks, "sinks");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    this.threadName = "funnel-collector-" + IDS.incrementAndGet();
  }

  /**
   * Starts the collector thread.
   *
   * @throws IllegalStateException if the loop was already started or stopped
   */
  public void start() {
    if (!state.compareAndSet(CollectorState.NOT_STARTED, CollectorState.RUNNING)) {
      throw new IllegalStateException("Collector already " + state.get().name().toLowerCase(Locale.ROOT));
    }
    executor = ExecutorFactories.newCollectorExecutor(threadName,
        (thread, ex) -> log.error("Collector thread {} terminated unexpectedly", thread.getName(), ex));
    executor.execute(this::drain);
    log.debug("Started collector {}", threadName);
  }

  private void drain() {
    MDC.put(MDC_MODE, OperatingMode.AGGREGATION_OWNER.name());
    try {
      while (true) {
        Optional<LogRecord> next = channel.receive();
        if (next.isEmpty()) {
          break;
        }
        dispatchOne(next.get());
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.warn("Collector {} interrupted with {} records undelivered", threadName, channel.size());
    } finally {
      sinks.closeAll();
      state.set(CollectorState.STOPPED);
      finished.countDown();
      log.debug("Collector {} stopped after {} records", threadName, dispatched.get());
      MDC.remove(MDC_MODE);
    }
  }

  private void dispatchOne(LogRecord record) {
    try {
      dispatcher.dispatch(record);
      dispatched.incrementAndGet();
      metrics.increment("funnel.collector.dispatched");
    } catch (RuntimeException ex) {
      metrics.increment("funnel.collector.dispatch.error");
      log.warn("Failed to dispatch record from channel {}", record.channelName(), ex);
    }
  }

  /**
   * Closes the channel, waits until the backlog is written, and closes the sinks.
   *
   * <p>Only the first call does the work; a concurrent or later call waits for that work to finish and returns
   * {@code false}. If the waiting thread is interrupted it returns early with its interrupt flag set; the
   * collector keeps draining and closes the sinks itself.</p>
   *
   * @return {@code true} if this call performed the shutdown
   */
  public boolean stop() {
    if (state.compareAndSet(CollectorState.NOT_STARTED, CollectorState.STOPPED)) {
      channel.close();
      sinks.closeAll();
      finished.countDown();
      return true;
    }
    if (!state.compareAndSet(CollectorState.RUNNING, CollectorState.DRAINING)) {
      // the loop may also have ended on its own if the channel was closed elsewhere
      awaitFinished();
      ExecutorService current = executor;
      if (current != null) {
        current.shutdown();
      }
      return false;
    }
    log.debug("Draining collector {} ({} records queued)", threadName, channel.size());
    channel.close();
    executor.shutdown();
    if (!awaitFinished()) {
      return true;
    }
    sinks.closeAll();
    state.set(CollectorState.STOPPED);
    return true;
  }

  private boolean awaitFinished() {
    long reportMs = Math.max(1L, shutdownTimeout.toMillis());
    long waitedMs = 0L;
    try {
      while (!finished.await(reportMs, TimeUnit.MILLISECONDS)) {
        waitedMs += reportMs;
        log.warn("Collector {} still draining after {} ms ({} records queued)", threadName, waitedMs, channel.size());
      }
      return true;
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.warn("Stopped waiting for collector {} with {} records queued; it closes the sinks when drained",
          threadName, channel.size());
      return false;
    }
  }

  public CollectorState state() {
    return state.get();
  }

  /** Records dispatched so far. */
  public long dispatchedCount() {
    return dispatched.get();
  }

  public String threadName() {
    return threadName;
  }
}
