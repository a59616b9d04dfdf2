package ca.gc.cra.funnel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.funnel.domain.log.Severity;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LoggingConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void loadsYamlWithEveryHandlerKind() throws Exception {
    Path config = write("logging.yaml", String.join("\n",
        "root:",
        "  level: WARNING",
        "  handlers: [console]",
        "loggers:",
        "  app:",
        "    level: info",
        "    handlers: [rolling]",
        "  app.db:",
        "    propagate: false",
        "handlers:",
        "  console:",
        "    type: stream",
        "    stream: stdout",
        "    formatter:",
        "      format: '%(levelname)s %(message)s'",
        "  plain:",
        "    type: file",
        "    filename: '" + tempDir.resolve("plain.log") + "'",
        "    mode: w",
        "  rolling:",
        "    type: rotating_file",
        "    filename: '" + tempDir.resolve("app.log") + "'",
        "    max_bytes: 2048",
        "    backup_count: 3",
        "  daily:",
        "    type: timed_rotating_file",
        "    filename: '" + tempDir.resolve("daily.log") + "'",
        "    when: H",
        "    interval: 6",
        "    utc: true",
        "queue:",
        "  size: 500",
        "  overflow: drop",
        "  shutdown_timeout_ms: 250",
        ""));

    LoggingConfig loaded = LoggingConfigLoader.load(config);

    assertEquals(Severity.WARNING, loaded.root().level());
    assertEquals(List.of("console"), loaded.root().handlers());
    ChannelSpec app = loaded.channels().get("app");
    assertEquals(Severity.INFO, app.level());
    assertFalse(app.propagate(), "channel with own handlers follows the root's propagate flag");
    ChannelSpec db = loaded.channels().get("app.db");
    assertNull(db.level());
    assertFalse(db.propagate());

    assertEquals(4, loaded.sinks().size());
    SinkSpec console = loaded.sinks().get(0);
    assertEquals(SinkKind.CONSOLE, console.kind());
    assertEquals(ConsoleTarget.STDOUT, console.target());
    assertEquals("%(levelname)s %(message)s", console.format().template());
    SinkSpec plain = loaded.sinks().get(1);
    assertFalse(plain.append());
    SinkSpec rolling = loaded.sinks().get(2);
    assertEquals(2048L, rolling.maxBytes());
    assertEquals(3, rolling.backupCount());
    SinkSpec daily = loaded.sinks().get(3);
    assertEquals(RotationUnit.HOURS, daily.when());
    assertEquals(6, daily.interval());
    assertTrue(daily.utc());
    assertEquals(SinkSpec.DEFAULT_TIME_BACKUPS, daily.backupCount());

    assertEquals(500, loaded.queue().capacity());
    assertEquals(OverflowPolicy.DROP, loaded.queue().overflow());
    assertEquals(Duration.ofMillis(250), loaded.queue().shutdownTimeout());
    assertEquals(config, loaded.sourcePath().orElseThrow());
  }

  @Test
  void loadsJsonWithDefaults() throws Exception {
    Path config = write("logging.json",
        "{\"handlers\": {\"console\": {\"level\": \"debug\"}}, \"loggers\": {\"svc\": {\"level\": 10}}}");

    LoggingConfig loaded = LoggingConfigLoader.load(config);

    assertFalse(loaded.root().levelConfigured());
    assertNull(loaded.root().handlers(), "root handlers default to every handler");
    SinkSpec console = loaded.sinks().get(0);
    assertEquals(SinkKind.CONSOLE, console.kind());
    assertEquals(Severity.DEBUG, console.level());
    assertEquals(ConsoleTarget.STDERR, console.target());
    assertEquals(FormatSpec.DEFAULT_TEMPLATE, console.format().template());
    assertEquals(Severity.DEBUG, loaded.channels().get("svc").level());
    assertTrue(loaded.channels().get("svc").propagate());
    assertFalse(loaded.queue().bounded());
  }

  @Test
  void emptyYamlYieldsDefaults() throws Exception {
    LoggingConfig loaded = LoggingConfigLoader.load(write("empty.yml", ""));

    assertTrue(loaded.sinks().isEmpty());
    assertNull(loaded.root().level());
    assertEquals(MetricsSettings.Exporter.NONE, loaded.metrics().exporter());
  }

  @Test
  void missingFileIsRejected() {
    Path missing = tempDir.resolve("absent.yaml");
    ConfigParseException ex = assertThrows(ConfigParseException.class, () -> LoggingConfigLoader.load(missing));
    assertEquals(missing, ex.source().orElseThrow());
  }

  @Test
  void unsupportedSuffixIsRejected() throws Exception {
    Path config = write("logging.toml", "root = 1");
    ConfigParseException ex = assertThrows(ConfigParseException.class, () -> LoggingConfigLoader.load(config));
    assertTrue(ex.getMessage().contains("toml"), ex.getMessage());
  }

  @Test
  void malformedDocumentsAreRejected() throws Exception {
    Path yaml = write("bad.yaml", "root: [unclosed\n");
    Path json = write("bad.json", "{\"root\": ");
    assertThrows(ConfigParseException.class, () -> LoggingConfigLoader.load(yaml));
    assertThrows(ConfigParseException.class, () -> LoggingConfigLoader.load(json));
  }

  @Test
  void invalidValuesAreRejected() throws Exception {
    Path badLevel = write("level.yaml", "root:\n  level: LOUD\n");
    Path badType = write("type.yaml", "handlers:\n  h:\n    type: socket\n");
    Path negative = write("neg.yaml", "handlers:\n  h:\n    type: rotating_file\n    max_bytes: -5\n");
    Path unknownRef = write("ref.yaml", "root:\n  handlers: [missing]\n");

    assertThrows(ConfigParseException.class, () -> LoggingConfigLoader.load(badLevel));
    assertThrows(ConfigParseException.class, () -> LoggingConfigLoader.load(badType));
    assertThrows(ConfigParseException.class, () -> LoggingConfigLoader.load(negative));
    assertThrows(ConfigParseException.class, () -> LoggingConfigLoader.load(unknownRef));
  }

  private Path write(String name, String content) throws Exception {
    Path file = tempDir.resolve(name);
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }
}
