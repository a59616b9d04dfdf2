package ca.gc.cra.funnel.config;

import ca.gc.cra.funnel.domain.log.Severity;
import ca.gc.cra.funnel.validation.Strings;
import java.util.List;

/**
 * Configured settings for the root channel or one named channel.
 *
 * @param name dotted channel name; {@link #ROOT} for the root channel
 * @param level explicit minimum severity; {@code null} inherits from the nearest ancestor, or on the root means
 *     "not configured" ({@link #DEFAULT_ROOT_LEVEL} applies unless a channel is requested with its own default)
 * @param propagate whether records continue to the parent channel's sinks
 * @param handlers handler names attached to this channel; {@code null} on the root means every handler
 * @since 0.1.0
 */
public record ChannelSpec(String name, Severity level, boolean propagate, List<String> handlers) {
  /** Name of the root channel. */
  public static final String ROOT = "root";
  /** Root level used when the configuration does not set one. */
  public static final Severity DEFAULT_ROOT_LEVEL = Severity.INFO;

  public ChannelSpec {
    name = Strings.requireChannelName("channel name", name);
    handlers = handlers == null ? null : List.copyOf(handlers);
  }

  /**
   * Returns the default root settings: no configured level, no propagation, every handler attached.
   *
   * @return root spec
   */
  public static ChannelSpec defaultRoot() {
    return new ChannelSpec(ROOT, null, false, null);
  }

  /**
   * Reports whether the configuration fixes this channel's level.
   *
   * @return {@code true} when {@link #level()} is set
   */
  public boolean levelConfigured() {
    return level != null;
  }

  /**
   * Reports whether this spec describes the root channel.
   *
   * @return {@code true} for {@link #ROOT}
   */
  public boolean isRoot() {
    return ROOT.equals(name);
  }

  static ChannelSpec rootFromSection(Section section) {
    Severity level = section.severity("level", null);
    boolean propagate = section.bool("propagate", false);
    return new ChannelSpec(ROOT, level, propagate, section.stringList("handlers"));
  }

  static ChannelSpec fromSection(String name, Section section, boolean rootPropagate) {
    Severity level = section.has("level") ? section.severity("level", null) : null;
    List<String> handlers = section.stringList("handlers");
    // A channel with its own handlers follows the root's propagate default to avoid duplicate lines.
    boolean defaultPropagate = handlers == null || handlers.isEmpty() || rootPropagate;
    boolean propagate = section.bool("propagate", defaultPropagate);
    return new ChannelSpec(name, level, propagate, handlers == null ? List.of() : handlers);
  }
}
