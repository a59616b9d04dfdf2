package ca.gc.cra.funnel.testing;

import ca.gc.cra.funnel.application.port.ClockPort;
import java.util.concurrent.atomic.AtomicLong;

/** Clock tests advance by hand. */
public final class MutableClock implements ClockPort {
  private final AtomicLong now;

  public MutableClock(long startMillis) {
    this.now = new AtomicLong(startMillis);
  }

  @Override
  public long nowMillis() {
    return now.get();
  }

  public void advance(long millis) {
    now.addAndGet(millis);
  }
}
