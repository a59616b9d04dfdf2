package ca.gc.cra.funnel.application.lifecycle;

import ca.gc.cra.funnel.application.dispatch.SinkSet;
import ca.gc.cra.funnel.application.pipeline.CollectorLoop;
import ca.gc.cra.funnel.domain.log.OperatingMode;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Starts and stops the moving parts behind one facade.
 * <p><strong>Stop order:</strong> drain hooks (for example pipe readers), then the collector (which closes the
 * channel, writes the backlog, and closes the sinks) or, without a collector, the sinks directly, then the
 * post-stop hooks. Workers hold no sinks and never close the channel they were handed.</p>
 * <p><strong>Idempotence:</strong> Only the first {@link #stop()} does any work; concurrent callers, including the
 * shutdown hook, wait until it has finished.</p>
 * <p><strong>Process exit:</strong> When enabled, a JVM shutdown hook calls {@link #stop()}; an explicit stop
 * removes it.</p>
 * <p><strong>Thread-safety:</strong> Safe to stop from any thread, including the shutdown hook.</p>
 *
 * @since 0.1.0
 */
public final class LoggingLifecycle {
  private static final Logger log = LoggerFactory.getLogger(LoggingLifecycle.class);

  private final OperatingMode mode;
  private final SinkSet sinks;
  private final CollectorLoop collector;
  private final boolean registerShutdownHook;
  private final List<Runnable> beforeDrain = new CopyOnWriteArrayList<>();
  private final List<Runnable> afterStop = new CopyOnWriteArrayList<>();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopped = new AtomicBoolean();
  private final CountDownLatch shutdownDone = new CountDownLatch(1);
  private volatile Thread shutdownHook;
  private volatile Thread stoppingThread;

  /**
   * @param mode resolved operating mode
   * @param sinks sinks owned by this process; empty for workers
   * @param collector collector for aggregation owners; {@code null} otherwise
   * @param registerShutdownHook whether to stop automatically at JVM exit
   */
  public LoggingLifecycle(OperatingMode mode, SinkSet sinks, CollectorLoop collector, boolean registerShutdownHook) {
    this.mode = Objects.requireNonNull(mode, "mode");
    this.sinks = Objects.requireNonNull(sinks, "sinks");
    if ((mode == OperatingMode.AGGREGATION_OWNER) != (collector != null)) {
      throw new IllegalArgumentException("a collector is required exactly in aggregation-owner mode");
    }
    this.collector = collector;
    this.registerShutdownHook = registerShutdownHook;
  }

  /**
   * Registers work to run before the collector drains, such as stopping pipe readers.
   *
   * @param action hook to run once during stop
   */
  public void onBeforeDrain(Runnable action) {
    beforeDrain.add(Objects.requireNonNull(action, "action"));
  }

  /**
   * Registers work to run after sinks are closed, such as shutting down metrics exporters.
   *
   * @param action hook to run once during stop
   */
  public void onStopped(Runnable action) {
    afterStop.add(Objects.requireNonNull(action, "action"));
  }

  /**
   * Starts the collector and installs the shutdown hook.
   *
   * @throws IllegalStateException if already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Lifecycle already started");
    }
    if (collector != null) {
      collector.start();
    }
    if (registerShutdownHook && mode != OperatingMode.WORKER) {
      Thread hook = new Thread(this::stopFromHook, "funnel-shutdown");
      Runtime.getRuntime().addShutdownHook(hook);
      shutdownHook = hook;
    }
  }

  /**
   * Stops everything once. A call made while another thread is stopping waits for that shutdown to finish.
   *
   * @return {@code true} if this call performed the shutdown
   */
  public boolean stop() {
    if (!stopped.compareAndSet(false, true)) {
      awaitShutdown();
      return false;
    }
    removeShutdownHook();
    shutdown();
    return true;
  }

  private void stopFromHook() {
    if (stopped.compareAndSet(false, true)) {
      log.debug("Stopping {} logging at JVM exit", mode);
      shutdown();
    } else {
      awaitShutdown();
    }
  }

  private void shutdown() {
    stoppingThread = Thread.currentThread();
    try {
      runAll(beforeDrain);
      if (collector != null) {
        collector.stop();
      } else {
        sinks.closeAll();
      }
      runAll(afterStop);
      log.debug("Logging lifecycle for {} mode stopped", mode);
    } finally {
      shutdownDone.countDown();
    }
  }

  private void awaitShutdown() {
    // a stop hook that calls stop() again must not wait on itself
    if (Thread.currentThread() == stoppingThread) {
      return;
    }
    try {
      shutdownDone.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.debug("Interrupted while waiting for {} logging to stop", mode);
    }
  }

  private void runAll(List<Runnable> actions) {
    for (Runnable action : actions) {
      try {
        action.run();
      } catch (RuntimeException ex) {
        log.warn("Logging shutdown step failed", ex);
      }
    }
  }

  private void removeShutdownHook() {
    Thread hook = shutdownHook;
    if (hook == null) {
      return;
    }
    shutdownHook = null;
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException alreadyExiting) {
      log.debug("JVM already shutting down; shutdown hook left in place");
    }
  }

  public boolean isStopped() {
    return stopped.get();
  }

  public OperatingMode mode() {
    return mode;
  }

  /** Whether a shutdown hook is currently installed. */
  public boolean hasShutdownHook() {
    return shutdownHook != null;
  }
}
