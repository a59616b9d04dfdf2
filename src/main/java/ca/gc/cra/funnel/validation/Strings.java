package ca.gc.cra.funnel.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * String validation helpers for channel and sink names.
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern CHANNEL_PATTERN = Pattern.compile("^[A-Za-z0-9_$-]+(\\.[A-Za-z0-9_$-]+)*$");

  private Strings() {
    // Utility
  }

  /**
   * Trims {@code value} and rejects blanks and control characters.
   *
   * @param name label used in error messages
   * @param value candidate string
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if blank or containing control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a dotted channel name such as {@code app.db.pool}.
   *
   * @param name label used in error messages
   * @param channel candidate channel name
   * @return trimmed channel name
   * @throws IllegalArgumentException if a segment is empty or contains unsupported characters
   */
  public static String requireChannelName(String name, String channel) {
    String sanitized = requireNonBlank(name, channel);
    if (!CHANNEL_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must be dot-separated segments of letters, digits, underscore, dollar, or hyphen (was '"
              + sanitized + "')"));
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
