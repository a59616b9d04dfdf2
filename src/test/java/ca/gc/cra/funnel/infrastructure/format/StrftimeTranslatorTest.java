package ca.gc.cra.funnel.infrastructure.format;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.funnel.testing.Records;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class StrftimeTranslatorTest {
  private static final Instant TIME = Instant.ofEpochMilli(Records.FIXED_TIME);

  @Test
  void translatesCommonDirectives() {
    assertEquals("2024-01-31 13:05:07", format("%Y-%m-%d %H:%M:%S"));
    assertEquals("Wed 31 Jan 24 01:05 PM", format("%a %d %b %y %I:%M %p"));
    assertEquals("Wednesday January 031", format("%A %B %j"));
    assertEquals("089000", format("%f"));
  }

  @Test
  void keepsLettersAndPercentLiteral() {
    assertEquals("2024-01-31T13 100%", format("%Y-%m-%dT%H 100%%"));
    assertEquals("at %Q", format("at %Q"));
    assertEquals("end%", format("end%"));
  }

  @Test
  void rendersInRequestedZone() {
    assertEquals("08 -0500",
        StrftimeTranslator.toFormatter("%H %z", ZoneId.of("America/Toronto")).format(TIME));
    assertEquals("+0000", StrftimeTranslator.toFormatter("%z", ZoneOffset.UTC).format(TIME));
  }

  private static String format(String pattern) {
    return StrftimeTranslator.toFormatter(pattern, ZoneOffset.UTC).format(TIME);
  }
}
