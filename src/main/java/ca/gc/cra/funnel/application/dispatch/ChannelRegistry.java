package ca.gc.cra.funnel.application.dispatch;

import ca.gc.cra.funnel.config.ChannelSpec;
import ca.gc.cra.funnel.config.LoggingConfig;
import ca.gc.cra.funnel.domain.log.Severity;
import ca.gc.cra.funnel.validation.Strings;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Tree of named channels with levels, propagation flags, and attached sinks.
 * <p><strong>Why:</strong> Decides which records pass a channel and which sinks receive them.</p>
 * <p><strong>Role:</strong> Owned by one facade; never shared through a static registry.</p>
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>A channel's effective level is its own level, else the nearest dotted ancestor's, else the root's.</li>
 *   <li>A default level passed to {@link #attach} applies only when neither the channel, an ancestor, nor the
 *   root has a configured level.</li>
 *   <li>Routing collects sinks from the channel up through its ancestors, stopping after the first node whose
 *   {@code propagate} flag is {@code false}. Each sink receives a record at most once.</li>
 *   <li>Channels created on demand have no sinks, no level, and propagate.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent lookups and on-demand creation.</p>
 *
 * @since 0.1.0
 */
public final class ChannelRegistry {
  private static final Logger log = LoggerFactory.getLogger(ChannelRegistry.class);

  private final ConcurrentMap<String, Node> nodes = new ConcurrentHashMap<>();
  private final Set<String> configuredLevels = ConcurrentHashMap.newKeySet();
  private final Node root;

  /**
   * Builds the tree from configuration, attaching the sinks that were built successfully.
   *
   * @param config logging configuration
   * @param sinks sinks owned by this process; empty for workers
   */
  public ChannelRegistry(LoggingConfig config, SinkSet sinks) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(sinks, "sinks");
    ChannelSpec rootSpec = config.root();
    List<SinkBinding> rootBindings = rootSpec.handlers() == null
        ? new ArrayList<>(sinks.all())
        : resolve(rootSpec, sinks);
    this.root = new Node(ChannelSpec.ROOT,
        Objects.requireNonNullElse(rootSpec.level(), ChannelSpec.DEFAULT_ROOT_LEVEL), false, rootBindings);
    nodes.put(ChannelSpec.ROOT, root);
    if (rootSpec.levelConfigured()) {
      configuredLevels.add(ChannelSpec.ROOT);
    }
    for (ChannelSpec spec : config.channels().values()) {
      if (spec.isRoot()) {
        continue;
      }
      nodes.put(spec.name(), new Node(spec.name(), spec.level(), spec.propagate(), resolve(spec, sinks)));
      if (spec.level() != null) {
        configuredLevels.add(spec.name());
      }
    }
  }

  /**
   * Maps {@code null} or blank names to {@code "root"} and validates the rest.
   *
   * @param name requested channel name
   * @return canonical name
   * @throws IllegalArgumentException if the name has empty segments or illegal characters
   */
  public static String normalize(String name) {
    if (name == null || name.isBlank()) {
      return ChannelSpec.ROOT;
    }
    return Strings.requireChannelName("channel name", name.trim());
  }

  /**
   * Returns the channel, creating it when absent.
   *
   * @param name channel name
   * @param defaultLevel level applied unless the configuration determines one for this channel;
   *     {@code null} keeps the current level
   * @return canonical channel name
   */
  public String attach(String name, Severity defaultLevel) {
    String canonical = normalize(name);
    Node node = nodes.computeIfAbsent(canonical, key -> new Node(key, null, true, List.of()));
    if (defaultLevel != null && !levelConfiguredFor(canonical)) {
      node.level = defaultLevel;
    }
    return canonical;
  }

  private boolean levelConfiguredFor(String name) {
    for (String current = name; current != null; current = parentOf(current)) {
      if (configuredLevels.contains(current)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Resolves the effective level of {@code name}.
   *
   * @param name canonical channel name
   * @return effective minimum severity
   */
  public Severity effectiveLevel(String name) {
    for (String current = name; current != null; current = parentOf(current)) {
      Node node = nodes.get(current);
      if (node != null && node.level != null) {
        return node.level;
      }
    }
    return root.level;
  }

  /**
   * Tests whether {@code severity} passes the effective level of {@code name}.
   *
   * @param name canonical channel name
   * @param severity record severity
   * @return {@code true} if a record would be emitted
   */
  public boolean isEnabled(String name, Severity severity) {
    return severity.isAtLeast(effectiveLevel(name));
  }

  /**
   * Lists the sinks reached by a record on {@code name}, nearest first.
   *
   * @param name canonical channel name
   * @return distinct sink bindings
   */
  public List<SinkBinding> route(String name) {
    Set<SinkBinding> targets = new LinkedHashSet<>();
    for (String current = name; current != null; current = parentOf(current)) {
      Node node = nodes.get(current);
      if (node == null) {
        continue;
      }
      targets.addAll(node.bindings);
      if (!node.propagate) {
        break;
      }
    }
    return List.copyOf(targets);
  }

  /** Names of every known channel, root included. */
  public Collection<String> channelNames() {
    return List.copyOf(nodes.keySet());
  }

  static String parentOf(String name) {
    if (ChannelSpec.ROOT.equals(name)) {
      return null;
    }
    int dot = name.lastIndexOf('.');
    return dot < 0 ? ChannelSpec.ROOT : name.substring(0, dot);
  }

  private static List<SinkBinding> resolve(ChannelSpec spec, SinkSet sinks) {
    List<SinkBinding> bindings = new ArrayList<>();
    List<String> names = spec.handlers() == null ? List.of() : spec.handlers();
    for (String handler : names) {
      sinks.get(handler).ifPresentOrElse(
          bindings::add,
          () -> log.debug("Channel {} skips handler {} because it was not built", spec.name(), handler));
    }
    return List.copyOf(bindings);
  }

  private static final class Node {
    private final String name;
    private final boolean propagate;
    private final List<SinkBinding> bindings;
    private volatile Severity level;

    Node(String name, Severity level, boolean propagate, List<SinkBinding> bindings) {
      this.name = name;
      this.level = level;
      this.propagate = propagate;
      this.bindings = List.copyOf(bindings);
    }

    @Override
    public String toString() {
      return "Node(" + name + ")";
    }
  }
}
