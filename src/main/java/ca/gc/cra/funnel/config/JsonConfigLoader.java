package ca.gc.cra.funnel.config;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a JSON logging configuration into a {@link Map}/{@link List} object graph using Jackson's streaming parser.
 */
final class JsonConfigLoader {
  private static final JsonFactory FACTORY = new JsonFactory();

  private JsonConfigLoader() {}

  /**
   * Parses the JSON document at {@code path}.
   *
   * @param path JSON file
   * @return root node, or {@code null} for an empty document
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the JSON is malformed
   */
  static Object load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        JsonParser parser = FACTORY.createParser(reader)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return null;
      }
      Object value = readValue(parser, token);
      if (parser.nextToken() != null) {
        throw new IllegalArgumentException("JSON config at " + path + " contains trailing content");
      }
      return value;
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Failed to parse JSON config at " + path, ex);
    }
  }

  private static Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private static Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private static List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
