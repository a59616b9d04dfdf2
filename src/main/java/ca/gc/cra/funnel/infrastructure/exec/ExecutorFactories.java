package ca.gc.cra.funnel.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the threads the logging pipeline runs on.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds the single-threaded executor hosting a collector loop.
   *
   * <p>The thread is non-daemon so pending records are written before the JVM exits normally.</p>
   *
   * @param threadName name of the collector thread
   * @param handler uncaught exception handler installed on the thread
   * @return configured executor service
   */
  public static ExecutorService newCollectorExecutor(String threadName, UncaughtExceptionHandler handler) {
    String name = (threadName == null || threadName.isBlank()) ? "funnel-collector" : threadName;
    ThreadFactory factory = threadFactory(name, false, handler, false);
    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds an unbounded pool of daemon threads for pipe readers; each attached pipe occupies one thread.
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on each thread
   * @return configured executor service
   */
  public static ExecutorService newPipeReaderPool(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "funnel-pipe" : prefix;
    return new ThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        30L,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        threadFactory(threadPrefix, true, handler, true),
        new ThreadPoolExecutor.AbortPolicy());
  }

  private static ThreadFactory threadFactory(
      String name, boolean daemon, UncaughtExceptionHandler handler, boolean numbered) {
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(numbered ? name + "-" + index.getAndIncrement() : name);
      thread.setDaemon(daemon);
      if (handler != null) {
        thread.setUncaughtExceptionHandler(handler);
      }
      return thread;
    };
  }
}
