package ca.gc.cra.funnel.infrastructure.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.funnel.config.FormatSpec;
import ca.gc.cra.funnel.domain.log.LogRecord;
import ca.gc.cra.funnel.domain.log.Severity;
import ca.gc.cra.funnel.testing.Records;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class PatternRecordFormatterTest {
  @Test
  void defaultTemplateRendersTimestampNameLevelAndMessage() {
    PatternRecordFormatter formatter = new PatternRecordFormatter(FormatSpec.defaults(), ZoneOffset.UTC);

    String line = formatter.format(Records.info("app.sub", "order placed"));

    assertEquals("2024-01-31 13:05:07 - app.sub - INFO - order placed", line);
  }

  @Test
  void widthsFlagsAndCallSiteFields() {
    FormatSpec spec = new FormatSpec(
        "[%(levelname)-8s] %(msecs)03d %(levelno)d %(filename)s:%(lineno)d %(funcName)s %(module)s "
            + "%(process)d %(processName)s %(threadName)s 100%%",
        "%H:%M");
    PatternRecordFormatter formatter = new PatternRecordFormatter(spec, ZoneOffset.UTC);

    String line = formatter.format(Records.record("app", Severity.WARNING, "ignored"));

    assertEquals("[WARNING ] 089 30 OrderService.java:42 placeOrder OrderService 4242 MainProcess main 100%", line);
  }

  @Test
  void createdRendersFractionalSeconds() {
    PatternRecordFormatter formatter =
        new PatternRecordFormatter(new FormatSpec("%(created).3f|%(asctime)s", "%d/%b/%y %I%p"), ZoneOffset.UTC);

    assertEquals("1706706307.089|31/Jan/24 01PM", formatter.format(Records.info("app", "x")));
  }

  @Test
  void appendsStackTraceOnNextLine() {
    LogRecord record = new LogRecord(Records.FIXED_TIME, "app", Severity.ERROR, "boom", null, "main", 1L, "p",
        "java.lang.IllegalStateException: bad\n\tat Foo.bar(Foo.java:1)");
    PatternRecordFormatter formatter =
        new PatternRecordFormatter(new FormatSpec("%(levelname)s %(message)s %(filename)s", "%Y"), ZoneOffset.UTC);

    String text = formatter.format(record);

    assertTrue(text.startsWith("ERROR boom (unknown file)\njava.lang.IllegalStateException: bad"), text);
  }

  @Test
  void unknownFieldIsRejectedAtConstruction() {
    assertThrows(IllegalArgumentException.class,
        () -> new PatternRecordFormatter(new FormatSpec("%(hostname)s", "%Y"), ZoneOffset.UTC));
  }

  @Test
  void conflictingFlagsAreRejectedAtConstruction() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> new PatternRecordFormatter(FormatSpec.of("%(levelno)+ 5d %(message)s"), ZoneOffset.UTC));

    assertTrue(ex.getMessage().contains("%(levelno)+ 5d"));
  }
}
