package ca.gc.cra.funnel.application.lifecycle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.funnel.application.dispatch.ChannelRegistry;
import ca.gc.cra.funnel.application.dispatch.RecordDispatcher;
import ca.gc.cra.funnel.application.dispatch.SinkBinding;
import ca.gc.cra.funnel.application.dispatch.SinkSet;
import ca.gc.cra.funnel.application.pipeline.CollectorLoop;
import ca.gc.cra.funnel.application.pipeline.CollectorState;
import ca.gc.cra.funnel.application.port.MetricsPort;
import ca.gc.cra.funnel.config.LoggingConfig;
import ca.gc.cra.funnel.config.SinkSpec;
import ca.gc.cra.funnel.domain.log.OperatingMode;
import ca.gc.cra.funnel.domain.log.Severity;
import ca.gc.cra.funnel.infrastructure.channel.QueueRecordChannel;
import ca.gc.cra.funnel.testing.CollectingSink;
import ca.gc.cra.funnel.testing.Records;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;
import org.junit.jupiter.api.Test;

class LoggingLifecycleTest {
  private final CollectingSink sink = new CollectingSink();
  private final SinkSet sinks =
      new SinkSet(List.of(new SinkBinding("main", sink, Severity.DEBUG, r -> r.message())));

  @Test
  void ownerStopRunsHooksAroundDrain() {
    QueueRecordChannel channel = QueueRecordChannel.unbounded();
    CollectorLoop collector = collector(channel);
    LoggingLifecycle lifecycle = new LoggingLifecycle(OperatingMode.AGGREGATION_OWNER, sinks, collector, false);
    List<String> steps = new CopyOnWriteArrayList<>();
    lifecycle.onBeforeDrain(() -> {
      steps.add("before:" + collector.state());
      channel.send(Records.info("app", "from pipe"));
    });
    lifecycle.onStopped(() -> steps.add("after:" + collector.state()));

    lifecycle.start();
    channel.send(Records.info("app", "direct"));

    assertTrue(lifecycle.stop());
    assertFalse(lifecycle.stop());

    assertEquals(List.of("before:RUNNING", "after:STOPPED"), steps);
    assertEquals(List.of("direct", "from pipe"), sink.lines());
    assertEquals(1, sink.closeCount());
    assertTrue(lifecycle.isStopped());
  }

  @Test
  void concurrentStopsReturnOnlyAfterBacklogIsWritten() throws Exception {
    CollectingSink slowSink = new CollectingSink();
    SinkSet slowSinks = new SinkSet(List.of(new SinkBinding("main", slowSink, Severity.DEBUG, r -> {
      LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(1));
      return r.message();
    })));
    QueueRecordChannel channel = QueueRecordChannel.unbounded();
    LoggingLifecycle lifecycle = new LoggingLifecycle(
        OperatingMode.AGGREGATION_OWNER, slowSinks, collector(channel, slowSinks, Duration.ofMillis(20)), false);
    lifecycle.start();
    int backlog = 200;
    for (int i = 0; i < backlog; i++) {
      channel.send(Records.info("app", "r" + i));
    }

    CountDownLatch go = new CountDownLatch(1);
    List<Integer> writtenOnReturn = new CopyOnWriteArrayList<>();
    List<Boolean> performed = new CopyOnWriteArrayList<>();
    List<Thread> stoppers = new ArrayList<>();
    for (int t = 0; t < 2; t++) {
      Thread stopper = new Thread(() -> {
        try {
          go.await();
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          return;
        }
        performed.add(lifecycle.stop());
        writtenOnReturn.add(slowSink.lines().size());
      }, "stopper-" + t);
      stoppers.add(stopper);
      stopper.start();
    }
    go.countDown();
    for (Thread stopper : stoppers) {
      stopper.join(30_000);
    }

    assertEquals(List.of(backlog, backlog), writtenOnReturn);
    assertEquals(1, performed.stream().filter(Boolean::booleanValue).count());
    assertEquals(1, slowSink.closeCount());
  }

  @Test
  void stopHookCallingStopAgainDoesNotWaitOnItself() {
    LoggingLifecycle lifecycle = new LoggingLifecycle(OperatingMode.STANDALONE, sinks, null, false);
    List<Boolean> nested = new CopyOnWriteArrayList<>();
    lifecycle.onStopped(() -> nested.add(lifecycle.stop()));
    lifecycle.start();

    assertTimeoutPreemptively(Duration.ofSeconds(10), () -> assertTrue(lifecycle.stop()));

    assertEquals(List.of(false), nested);
  }

  @Test
  void standaloneStopClosesSinksOnce() {
    LoggingLifecycle lifecycle = new LoggingLifecycle(OperatingMode.STANDALONE, sinks, null, false);
    lifecycle.start();

    lifecycle.stop();
    lifecycle.stop();

    assertEquals(1, sink.closeCount());
    assertTrue(sinks.isClosed());
  }

  @Test
  void failingHookDoesNotAbortShutdown() {
    LoggingLifecycle lifecycle = new LoggingLifecycle(OperatingMode.STANDALONE, sinks, null, false);
    lifecycle.onBeforeDrain(() -> {
      throw new IllegalStateException("pipe already gone");
    });
    lifecycle.start();

    assertTrue(lifecycle.stop());

    assertEquals(1, sink.closeCount());
  }

  @Test
  void shutdownHookIsRegisteredAndRemoved() {
    LoggingLifecycle lifecycle = new LoggingLifecycle(OperatingMode.STANDALONE, sinks, null, true);
    lifecycle.start();
    assertTrue(lifecycle.hasShutdownHook());

    lifecycle.stop();

    assertFalse(lifecycle.hasShutdownHook());
  }

  @Test
  void workersNeverRegisterShutdownHook() {
    LoggingLifecycle lifecycle = new LoggingLifecycle(OperatingMode.WORKER, SinkSet.empty(), null, true);
    lifecycle.start();

    assertFalse(lifecycle.hasShutdownHook());
    assertTrue(lifecycle.stop());
  }

  @Test
  void collectorPresenceMustMatchMode() {
    CollectorLoop collector = collector(QueueRecordChannel.unbounded());

    assertThrows(IllegalArgumentException.class,
        () -> new LoggingLifecycle(OperatingMode.AGGREGATION_OWNER, sinks, null, false));
    assertThrows(IllegalArgumentException.class,
        () -> new LoggingLifecycle(OperatingMode.STANDALONE, sinks, collector, false));
    assertEquals(CollectorState.NOT_STARTED, collector.state());
  }

  @Test
  void startTwiceIsRejected() {
    LoggingLifecycle lifecycle = new LoggingLifecycle(OperatingMode.STANDALONE, sinks, null, false);
    lifecycle.start();

    assertThrows(IllegalStateException.class, lifecycle::start);
    lifecycle.stop();
  }

  private CollectorLoop collector(QueueRecordChannel channel) {
    return collector(channel, sinks, Duration.ofSeconds(5));
  }

  private static CollectorLoop collector(QueueRecordChannel channel, SinkSet owned, Duration shutdownTimeout) {
    LoggingConfig config = LoggingConfig.of(List.of(SinkSpec.console("main", Severity.DEBUG)));
    RecordDispatcher dispatcher = new RecordDispatcher(new ChannelRegistry(config, owned), MetricsPort.NO_OP);
    return new CollectorLoop(channel, dispatcher, owned, MetricsPort.NO_OP, shutdownTimeout);
  }
}
