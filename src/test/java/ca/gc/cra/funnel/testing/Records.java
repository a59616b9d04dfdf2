package ca.gc.cra.funnel.testing;

import ca.gc.cra.funnel.domain.log.LogRecord;
import ca.gc.cra.funnel.domain.log.Severity;
import ca.gc.cra.funnel.domain.log.SourceLocation;

/** Builders for {@link LogRecord}s used across tests. */
public final class Records {
  /** 2024-01-31T13:05:07.089Z */
  public static final long FIXED_TIME = 1_706_706_307_089L;

  private Records() {}

  public static LogRecord record(String channel, Severity severity, String message) {
    return new LogRecord(FIXED_TIME, channel, severity, message,
        new SourceLocation("OrderService.java", 42, "placeOrder"), "main", 4242L, "MainProcess", null);
  }

  public static LogRecord info(String channel, String message) {
    return record(channel, Severity.INFO, message);
  }
}
