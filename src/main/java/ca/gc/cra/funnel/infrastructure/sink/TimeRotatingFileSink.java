package ca.gc.cra.funnel.infrastructure.sink;

import ca.gc.cra.funnel.application.port.ClockPort;
import ca.gc.cra.funnel.config.RotationUnit;
import ca.gc.cra.funnel.infrastructure.format.StrftimeTranslator;
import ca.gc.cra.funnel.util.PathUtils;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> File sink that rolls when the clock passes the next rollover instant.
 * <p><strong>Schedule:</strong> {@code S/M/H/D} roll every {@code interval} units from the time the file was
 * opened; {@code MIDNIGHT} rolls at the start of the day {@code interval} days later; {@code W0..W6} roll at
 * the start of the next matching weekday ({@code W0} is Monday), then every {@code interval} weeks.</p>
 * <p><strong>Backups:</strong> the closed file is renamed to {@code f.<period start>} using
 * {@link RotationUnit#suffixPattern()}; only the newest {@code backupCount} backups are kept
 * ({@code 0} keeps all).</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; callers serialize access.</p>
 *
 * @since 0.1.0
 */
public final class TimeRotatingFileSink extends FileSink {
  private static final long SECOND = 1_000L;
  private static final long MINUTE = 60 * SECOND;
  private static final long HOUR = 60 * MINUTE;
  private static final long DAY = 24 * HOUR;

  private final RotationUnit when;
  private final int interval;
  private final int backupCount;
  private final ZoneId zone;
  private final ClockPort clock;
  private final DateTimeFormatter suffixFormatter;
  private final Pattern backupPattern;
  private long rolloverAt;

  /**
   * @param path active file
   * @param encoding charset for lines
   * @param append keep existing content of {@code path}
   * @param when rotation unit
   * @param interval units between rollovers; at least {@code 1}
   * @param backupCount backups kept; {@code 0} keeps every backup
   * @param utc use UTC for boundaries and suffixes instead of the system zone
   * @param clock time source
   * @throws IOException if the file cannot be opened
   */
  public TimeRotatingFileSink(
      Path path,
      Charset encoding,
      boolean append,
      RotationUnit when,
      int interval,
      int backupCount,
      boolean utc,
      ClockPort clock)
      throws IOException {
    super(path, encoding, append);
    if (interval < 1) {
      throw new IllegalArgumentException("interval must be at least 1");
    }
    this.when = Objects.requireNonNull(when, "when");
    this.interval = interval;
    this.backupCount = backupCount;
    this.zone = utc ? ZoneOffset.UTC : ZoneId.systemDefault();
    this.clock = Objects.requireNonNull(clock, "clock");
    this.suffixFormatter = StrftimeTranslator.toFormatter(when.suffixPattern(), zone);
    this.backupPattern =
        Pattern.compile(Pattern.quote(path.getFileName() + ".") + "(" + when.suffixRegex() + ")");
    this.rolloverAt = nextRollover(clock.nowMillis());
  }

  @Override
  protected void beforeWrite(int length) throws IOException {
    long now = clock.nowMillis();
    if (now < rolloverAt) {
      return;
    }
    Path target = path().resolveSibling(
        path().getFileName() + "." + suffixFormatter.format(Instant.ofEpochMilli(periodStart(rolloverAt))));
    reopen(() -> {
      if (Files.exists(path())) {
        PathUtils.moveReplacing(path(), target);
      }
      deleteExpiredBackups();
    });
    long next = nextRollover(now);
    while (next <= now) {
      next = nextRollover(next);
    }
    rolloverAt = next;
  }

  /** Next rollover instant, exposed for tests. */
  long rolloverAt() {
    return rolloverAt;
  }

  long nextRollover(long fromMillis) {
    LocalDate day = Instant.ofEpochMilli(fromMillis).atZone(zone).toLocalDate();
    return switch (when) {
      case SECONDS -> fromMillis + interval * SECOND;
      case MINUTES -> fromMillis + interval * MINUTE;
      case HOURS -> fromMillis + interval * HOUR;
      case DAYS -> fromMillis + interval * DAY;
      case MIDNIGHT -> day.plusDays(interval).atStartOfDay(zone).toInstant().toEpochMilli();
      default -> day.with(TemporalAdjusters.next(when.dayOfWeek()))
          .plusWeeks(interval - 1L)
          .atStartOfDay(zone)
          .toInstant()
          .toEpochMilli();
    };
  }

  private long periodStart(long rollover) {
    LocalDate day = Instant.ofEpochMilli(rollover).atZone(zone).toLocalDate();
    return switch (when) {
      case SECONDS -> rollover - interval * SECOND;
      case MINUTES -> rollover - interval * MINUTE;
      case HOURS -> rollover - interval * HOUR;
      case DAYS -> rollover - interval * DAY;
      case MIDNIGHT -> day.minusDays(interval).atStartOfDay(zone).toInstant().toEpochMilli();
      default -> day.minusWeeks(interval).atStartOfDay(zone).toInstant().toEpochMilli();
    };
  }

  private void deleteExpiredBackups() throws IOException {
    if (backupCount <= 0) {
      return;
    }
    List<Path> backups = new ArrayList<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(PathUtils.parentDirectory(path()))) {
      for (Path entry : entries) {
        if (backupPattern.matcher(entry.getFileName().toString()).matches()) {
          backups.add(entry);
        }
      }
    }
    if (backups.size() <= backupCount) {
      return;
    }
    Collections.sort(backups);
    for (Path expired : backups.subList(0, backups.size() - backupCount)) {
      Files.deleteIfExists(expired);
    }
  }
}
