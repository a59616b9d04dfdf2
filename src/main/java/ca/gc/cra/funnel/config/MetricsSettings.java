package ca.gc.cra.funnel.config;

import java.util.Locale;
import java.util.Objects;

/**
 * Metrics exporter selection.
 *
 * @param exporter exporter kind
 * @param endpoint OTLP gRPC endpoint used when {@code exporter} is {@link Exporter#OTLP}
 * @since 0.1.0
 */
public record MetricsSettings(Exporter exporter, String endpoint) {
  /** Default OTLP collector endpoint. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  public MetricsSettings {
    exporter = Objects.requireNonNullElse(exporter, Exporter.NONE);
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
  }

  /**
   * Returns settings with metrics disabled.
   *
   * @return disabled settings
   */
  public static MetricsSettings disabled() {
    return new MetricsSettings(Exporter.NONE, DEFAULT_ENDPOINT);
  }

  static MetricsSettings fromSection(Section section) {
    return new MetricsSettings(
        Exporter.fromString(section.string("exporter", null)),
        section.string("endpoint", DEFAULT_ENDPOINT));
  }

  /** Supported exporters. */
  public enum Exporter {
    NONE,
    OTLP;

    static Exporter fromString(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> throw new IllegalArgumentException("metrics.exporter must be 'none' or 'otlp' (was '" + raw + "')");
      };
    }
  }
}
