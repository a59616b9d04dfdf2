package ca.gc.cra.funnel.config;

import ca.gc.cra.funnel.domain.log.Severity;
import ca.gc.cra.funnel.validation.Numbers;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Typed view over one mapping of a parsed YAML/JSON document.
 */
final class Section {
  private final String path;
  private final Map<String, Object> values;

  private Section(String path, Map<String, Object> values) {
    this.path = path;
    this.values = values;
  }

  static Section of(String path, Object node) {
    if (node == null) {
      return new Section(path, Map.of());
    }
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(path + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(path + " contains a non-string or blank key");
      }
      map.put(key, entry.getValue());
    }
    return new Section(path, map);
  }

  String path() {
    return path;
  }

  boolean has(String key) {
    return values.get(key) != null;
  }

  Map<String, Object> entries() {
    return values;
  }

  Section section(String key) {
    return of(child(key), values.get(key));
  }

  String string(String key, String fallback) {
    Object value = values.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
      throw new IllegalArgumentException(child(key) + " must be a scalar");
    }
    return value.toString();
  }

  long longValue(String key, long fallback, long min, long max) {
    Object value = values.get(key);
    if (value == null) {
      return fallback;
    }
    return Numbers.requireRange(child(key), Numbers.parseLong(child(key), value), min, max);
  }

  int intValue(String key, int fallback, int min, int max) {
    return (int) longValue(key, fallback, min, max);
  }

  boolean bool(String key, boolean fallback) {
    Object value = values.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Boolean flag) {
      return flag;
    }
    String normalized = value.toString().trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new IllegalArgumentException(child(key) + " must be a boolean (was '" + value + "')");
    };
  }

  Severity severity(String key, Severity fallback) {
    Object value = values.get(key);
    if (value == null) {
      return fallback;
    }
    try {
      return Severity.parse(value.toString());
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(child(key) + ": " + ex.getMessage(), ex);
    }
  }

  List<String> stringList(String key) {
    Object value = values.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof String single) {
      return List.of(single.trim());
    }
    if (!(value instanceof Iterable<?> items)) {
      throw new IllegalArgumentException(child(key) + " must be a list");
    }
    List<String> result = new ArrayList<>();
    for (Object item : items) {
      if (item == null) {
        throw new IllegalArgumentException(child(key) + " contains a null entry");
      }
      result.add(item.toString().trim());
    }
    return List.copyOf(result);
  }

  private String child(String key) {
    return path.isEmpty() ? key : path + "." + key;
  }
}
