package ca.gc.cra.funnel.infrastructure.channel;

import ca.gc.cra.funnel.domain.log.LogRecord;
import ca.gc.cra.funnel.domain.log.Severity;
import ca.gc.cra.funnel.domain.log.SourceLocation;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.util.Objects;

/**
 * Encodes {@link LogRecord}s as single-line JSON objects for transport over local pipes.
 *
 * <p>Layout: {@code {"v":1,"ts":..,"channel":..,"severity":..,"message":..,"thread":..,"pid":..,
 * "process":..,"location":{"file":..,"line":..,"method":..},"thrown":..}}. {@code location} and
 * {@code thrown} are omitted when absent. Unknown fields are ignored on decode.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonRecordCodec {
  static final int SCHEMA_VERSION = 1;

  private final JsonFactory jsonFactory;

  public NdjsonRecordCodec() {
    this(new JsonFactory());
  }

  /**
   * @param jsonFactory Jackson factory used for generators and parsers
   */
  public NdjsonRecordCodec(JsonFactory jsonFactory) {
    this.jsonFactory = Objects.requireNonNull(jsonFactory, "jsonFactory");
  }

  /**
   * Serializes a record without a trailing newline. JSON escaping keeps embedded newlines off the wire.
   *
   * @param record record to encode
   * @return one JSON line
   * @throws IOException if the generator fails
   */
  public String encode(LogRecord record) throws IOException {
    Objects.requireNonNull(record, "record");
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeNumberField("v", SCHEMA_VERSION);
      gen.writeNumberField("ts", record.timestampMillis());
      gen.writeStringField("channel", record.channelName());
      gen.writeStringField("severity", record.severity().name());
      gen.writeStringField("message", record.message());
      gen.writeStringField("thread", record.threadName());
      gen.writeNumberField("pid", record.processId());
      gen.writeStringField("process", record.processName());
      if (record.location() != null) {
        SourceLocation location = record.location();
        gen.writeObjectFieldStart("location");
        gen.writeStringField("file", location.file());
        gen.writeNumberField("line", location.line());
        gen.writeStringField("method", location.method());
        gen.writeEndObject();
      }
      if (record.thrown() != null) {
        gen.writeStringField("thrown", record.thrown());
      }
      gen.writeEndObject();
    }
    return out.toString();
  }

  /**
   * Parses one JSON line.
   *
   * @param line encoded record
   * @return decoded record
   * @throws IOException if the line is not a valid record
   */
  public LogRecord decode(String line) throws IOException {
    Objects.requireNonNull(line, "line");
    long timestamp = 0L;
    String channel = null;
    Severity severity = null;
    String message = "";
    String thread = "";
    long pid = 0L;
    String process = "";
    SourceLocation location = null;
    String thrown = null;
    try (JsonParser parser = jsonFactory.createParser(line)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IOException("Expected a JSON object");
      }
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        switch (field) {
          case "v" -> {
            if (parser.getIntValue() != SCHEMA_VERSION) {
              throw new IOException("Unsupported record schema version " + parser.getText());
            }
          }
          case "ts" -> timestamp = parser.getLongValue();
          case "channel" -> channel = parser.getText();
          case "severity" -> severity = parseSeverity(parser.getText());
          case "message" -> message = parser.getText();
          case "thread" -> thread = parser.getText();
          case "pid" -> pid = parser.getLongValue();
          case "process" -> process = parser.getText();
          case "location" -> location = value == JsonToken.START_OBJECT ? readLocation(parser) : null;
          case "thrown" -> thrown = value == JsonToken.VALUE_NULL ? null : parser.getText();
          default -> parser.skipChildren();
        }
      }
    } catch (JsonProcessingException ex) {
      throw new IOException("Malformed record line: " + ex.getOriginalMessage(), ex);
    }
    if (channel == null || severity == null) {
      throw new IOException("Record line lacks channel or severity");
    }
    return new LogRecord(timestamp, channel, severity, message, location, thread, pid, process, thrown);
  }

  private static SourceLocation readLocation(JsonParser parser) throws IOException {
    String file = null;
    int line = 0;
    String method = "";
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName();
      parser.nextToken();
      switch (field) {
        case "file" -> file = parser.getText();
        case "line" -> line = Math.max(0, parser.getIntValue());
        case "method" -> method = parser.getText();
        default -> parser.skipChildren();
      }
    }
    return new SourceLocation(file, line, method);
  }

  private static Severity parseSeverity(String raw) throws IOException {
    try {
      return Severity.parse(raw);
    } catch (IllegalArgumentException ex) {
      throw new IOException(ex.getMessage(), ex);
    }
  }
}
