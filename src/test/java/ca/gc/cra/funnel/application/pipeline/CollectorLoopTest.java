package ca.gc.cra.funnel.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.funnel.application.dispatch.ChannelRegistry;
import ca.gc.cra.funnel.application.dispatch.RecordDispatcher;
import ca.gc.cra.funnel.application.dispatch.SinkBinding;
import ca.gc.cra.funnel.application.dispatch.SinkSet;
import ca.gc.cra.funnel.application.port.RecordFormatter;
import ca.gc.cra.funnel.application.port.SendResult;
import ca.gc.cra.funnel.config.LoggingConfig;
import ca.gc.cra.funnel.config.SinkSpec;
import ca.gc.cra.funnel.domain.log.Severity;
import ca.gc.cra.funnel.infrastructure.channel.QueueRecordChannel;
import ca.gc.cra.funnel.testing.CollectingSink;
import ca.gc.cra.funnel.testing.RecordingMetrics;
import ca.gc.cra.funnel.testing.Records;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;
import org.junit.jupiter.api.Test;

class CollectorLoopTest {
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final QueueRecordChannel channel = QueueRecordChannel.unbounded();
  private final CollectingSink sink = new CollectingSink();

  @Test
  void stopWritesEveryRecordAcceptedBeforeIt() throws Exception {
    CollectorLoop loop = loop(new SinkBinding("main", sink, Severity.DEBUG, r -> r.message()));
    loop.start();
    assertEquals(CollectorState.RUNNING, loop.state());

    int producers = 3;
    int perProducer = 200;
    CountDownLatch done = new CountDownLatch(producers);
    List<Thread> threads = new ArrayList<>();
    for (int p = 0; p < producers; p++) {
      String name = "p" + p;
      Thread thread = new Thread(() -> {
        for (int i = 0; i < perProducer; i++) {
          channel.producerHandle().send(Records.info("app", name + "-" + i));
        }
        done.countDown();
      });
      threads.add(thread);
      thread.start();
    }
    done.await();

    assertTrue(loop.stop());

    assertEquals(CollectorState.STOPPED, loop.state());
    assertEquals(producers * perProducer, sink.lines().size());
    assertEquals(producers * perProducer, loop.dispatchedCount());
    assertEquals(1, sink.closeCount());
    assertEquals(SendResult.CLOSED, channel.send(Records.info("app", "late")));
  }

  @Test
  void stopWaitsForBacklogLongerThanShutdownTimeout() {
    CollectorLoop loop = loop(Duration.ofMillis(20), new SinkBinding("main", sink, Severity.DEBUG, slowly()));
    int backlog = 300;
    for (int i = 0; i < backlog; i++) {
      channel.send(Records.info("app", "r" + i));
    }
    loop.start();

    assertTimeoutPreemptively(Duration.ofSeconds(30), () -> assertTrue(loop.stop()));

    List<String> lines = sink.lines();
    assertEquals(backlog, lines.size());
    assertEquals("r" + (backlog - 1), lines.get(backlog - 1));
    assertEquals(1, sink.closeCount());
    assertEquals(CollectorState.STOPPED, loop.state());
  }

  @Test
  void concurrentStopWaitsForDrainInProgress() throws Exception {
    CollectorLoop loop = loop(Duration.ofMillis(20), new SinkBinding("main", sink, Severity.DEBUG, slowly()));
    int backlog = 200;
    for (int i = 0; i < backlog; i++) {
      channel.send(Records.info("app", "r" + i));
    }
    loop.start();
    Thread first = new Thread(loop::stop, "first-stop");
    first.start();
    while (loop.state() == CollectorState.RUNNING) {
      Thread.onSpinWait();
    }

    assertTimeoutPreemptively(Duration.ofSeconds(30), () -> assertFalse(loop.stop()));

    assertEquals(backlog, sink.lines().size());
    first.join(30_000);
    assertEquals(1, sink.closeCount());
  }

  @Test
  void stopIsIdempotent() {
    CollectorLoop loop = loop(new SinkBinding("main", sink, Severity.DEBUG, r -> r.message()));
    loop.start();
    channel.send(Records.info("app", "one"));

    assertTrue(loop.stop());
    assertFalse(loop.stop());
    assertFalse(loop.stop());

    assertEquals(List.of("one"), sink.lines());
    assertEquals(1, sink.closeCount());
  }

  @Test
  void stopBeforeStartClosesChannelAndSinks() {
    CollectorLoop loop = loop(new SinkBinding("main", sink, Severity.DEBUG, r -> r.message()));

    assertTrue(loop.stop());

    assertEquals(CollectorState.STOPPED, loop.state());
    assertTrue(channel.isClosed());
    assertEquals(1, sink.closeCount());
    assertThrows(IllegalStateException.class, loop::start);
  }

  @Test
  void startTwiceIsRejected() {
    CollectorLoop loop = loop(new SinkBinding("main", sink, Severity.DEBUG, r -> r.message()));
    loop.start();
    try {
      assertThrows(IllegalStateException.class, loop::start);
    } finally {
      loop.stop();
    }
  }

  @Test
  void failingSinkDoesNotStopCollection() {
    CollectorLoop loop = loop(
        new SinkBinding("broken", CollectingSink.failing(), Severity.DEBUG, r -> r.message()),
        new SinkBinding("main", sink, Severity.DEBUG, r -> r.message()));
    loop.start();
    channel.send(Records.info("app", "a"));
    channel.send(Records.info("app", "b"));

    loop.stop();

    assertEquals(List.of("a", "b"), sink.lines());
    assertEquals(2, metrics.counter("funnel.sink.write.error"));
    assertEquals(2, metrics.counter("funnel.collector.dispatched"));
  }

  @Test
  void collectorRunsOnNamedThread() {
    List<String> threads = new ArrayList<>();
    CollectorLoop loop = loop(new SinkBinding("main", sink, Severity.DEBUG, r -> {
      synchronized (threads) {
        threads.add(Thread.currentThread().getName());
      }
      return r.message();
    }));
    loop.start();
    channel.send(Records.info("app", "x"));
    loop.stop();

    assertEquals(List.of(loop.threadName()), threads);
    assertTrue(loop.threadName().startsWith("funnel-collector-"));
  }

  private static RecordFormatter slowly() {
    return r -> {
      LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(1));
      return r.message();
    };
  }

  private CollectorLoop loop(SinkBinding... bindings) {
    return loop(Duration.ofSeconds(5), bindings);
  }

  private CollectorLoop loop(Duration shutdownTimeout, SinkBinding... bindings) {
    List<SinkSpec> specs = new ArrayList<>();
    for (SinkBinding binding : bindings) {
      specs.add(SinkSpec.console(binding.name(), binding.level()));
    }
    SinkSet sinks = new SinkSet(List.of(bindings));
    RecordDispatcher dispatcher =
        new RecordDispatcher(new ChannelRegistry(LoggingConfig.of(specs), sinks), metrics);
    return new CollectorLoop(channel, dispatcher, sinks, metrics, shutdownTimeout);
  }
}
