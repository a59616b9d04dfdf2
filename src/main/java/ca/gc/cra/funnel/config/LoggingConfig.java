package ca.gc.cra.funnel.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Validated, immutable logging configuration.
 * <p><strong>Why:</strong> Loaded once at facade construction and shared read-only by every component.</p>
 * <p><strong>Role:</strong> Root configuration aggregate built from a YAML/JSON document by
 * {@link LoggingConfigLoader} or assembled programmatically.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param root root channel settings
 * @param channels named channel settings keyed by channel name, in document order
 * @param sinks sink specs in document order
 * @param queue record channel tuning
 * @param metrics metrics exporter selection
 * @param source file the configuration came from; {@code null} for programmatic configurations
 * @since 0.1.0
 */
public record LoggingConfig(
    ChannelSpec root,
    Map<String, ChannelSpec> channels,
    List<SinkSpec> sinks,
    QueueSettings queue,
    MetricsSettings metrics,
    Path source) {

  public LoggingConfig {
    root = Objects.requireNonNullElse(root, ChannelSpec.defaultRoot());
    if (!root.isRoot()) {
      throw new IllegalArgumentException("root spec must be named '" + ChannelSpec.ROOT + "'");
    }
    channels = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNullElse(channels, Map.of())));
    sinks = List.copyOf(Objects.requireNonNullElse(sinks, List.of()));
    queue = Objects.requireNonNullElse(queue, QueueSettings.defaults());
    metrics = Objects.requireNonNullElse(metrics, MetricsSettings.disabled());
    validateHandlerReferences(root, channels, sinks);
  }

  /**
   * Builds a configuration with the given sinks attached to a root whose level is left unset
   * ({@link ChannelSpec#DEFAULT_ROOT_LEVEL} unless a channel is requested with its own default).
   *
   * @param sinks sink specs
   * @return configuration with default queue and metrics settings
   */
  public static LoggingConfig of(List<SinkSpec> sinks) {
    return new LoggingConfig(ChannelSpec.defaultRoot(), Map.of(), sinks, null, null, null);
  }

  /**
   * Returns a copy with another root spec.
   *
   * @param newRoot root settings
   * @return updated configuration
   */
  public LoggingConfig withRoot(ChannelSpec newRoot) {
    return new LoggingConfig(newRoot, channels, sinks, queue, metrics, source);
  }

  /**
   * Returns a copy with an additional named channel.
   *
   * @param channel channel settings
   * @return updated configuration
   */
  public LoggingConfig withChannel(ChannelSpec channel) {
    Map<String, ChannelSpec> merged = new LinkedHashMap<>(channels);
    merged.put(channel.name(), channel);
    return new LoggingConfig(root, merged, sinks, queue, metrics, source);
  }

  /**
   * Returns a copy with other queue settings.
   *
   * @param newQueue queue settings
   * @return updated configuration
   */
  public LoggingConfig withQueue(QueueSettings newQueue) {
    return new LoggingConfig(root, channels, sinks, newQueue, metrics, source);
  }

  /**
   * Returns the source file when the configuration was loaded from disk.
   *
   * @return optional source path
   */
  public Optional<Path> sourcePath() {
    return Optional.ofNullable(source);
  }

  /**
   * Validates a parsed document and converts it into a configuration.
   *
   * @param document parsed YAML/JSON root mapping; {@code null} yields the defaults
   * @param source originating file for error messages; may be {@code null}
   * @return validated configuration
   * @throws ConfigParseException when the document is structurally invalid or holds invalid values
   */
  public static LoggingConfig fromDocument(Object document, Path source) {
    try {
      Section top = Section.of("", document);
      ChannelSpec root = ChannelSpec.rootFromSection(top.section("root"));

      Map<String, ChannelSpec> channels = new LinkedHashMap<>();
      for (Map.Entry<String, Object> entry : top.section("loggers").entries().entrySet()) {
        String name = entry.getKey().trim();
        Section section = Section.of("loggers." + name, entry.getValue());
        channels.put(name, ChannelSpec.fromSection(name, section, root.propagate()));
      }

      List<SinkSpec> sinks = new ArrayList<>();
      for (Map.Entry<String, Object> entry : top.section("handlers").entries().entrySet()) {
        String name = entry.getKey().trim();
        sinks.add(SinkSpec.fromSection(name, Section.of("handlers." + name, entry.getValue())));
      }

      QueueSettings queue = QueueSettings.fromSection(top.section("queue"));
      MetricsSettings metrics = MetricsSettings.fromSection(top.section("metrics"));
      return new LoggingConfig(root, channels, sinks, queue, metrics, source);
    } catch (IllegalArgumentException | NullPointerException ex) {
      throw new ConfigParseException(source, "Invalid logging configuration: " + ex.getMessage(), ex);
    }
  }

  private static void validateHandlerReferences(
      ChannelSpec root, Map<String, ChannelSpec> channels, List<SinkSpec> sinks) {
    Set<String> names = new HashSet<>();
    for (SinkSpec sink : sinks) {
      if (!names.add(sink.name())) {
        throw new IllegalArgumentException("duplicate handler name: " + sink.name());
      }
    }
    List<ChannelSpec> all = new ArrayList<>(channels.values());
    all.add(root);
    for (ChannelSpec channel : all) {
      if (channel.handlers() == null) {
        continue;
      }
      for (String handler : channel.handlers()) {
        if (!names.contains(handler)) {
          throw new IllegalArgumentException(
              "channel '" + channel.name() + "' references unknown handler '" + handler + "'");
        }
      }
    }
  }
}
