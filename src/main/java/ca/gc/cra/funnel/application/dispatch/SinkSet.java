package ca.gc.cra.funnel.application.dispatch;

import ca.gc.cra.funnel.application.port.SinkWriteException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named collection of the sinks a process owns.
 *
 * <p>{@link #closeAll()} releases every sink exactly once no matter how often it is called.</p>
 *
 * @since 0.1.0
 */
public final class SinkSet {
  private static final Logger log = LoggerFactory.getLogger(SinkSet.class);

  private final Map<String, SinkBinding> bindings;
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * @param bindings built sinks in configuration order; names must be unique
   * @throws IllegalArgumentException on duplicate names
   */
  public SinkSet(List<SinkBinding> bindings) {
    Map<String, SinkBinding> byName = new LinkedHashMap<>();
    for (SinkBinding binding : bindings) {
      if (byName.putIfAbsent(binding.name(), binding) != null) {
        throw new IllegalArgumentException("Duplicate sink name: " + binding.name());
      }
    }
    this.bindings = Collections.unmodifiableMap(byName);
  }

  /** Returns an empty set, used by worker processes. */
  public static SinkSet empty() {
    return new SinkSet(List.of());
  }

  public Optional<SinkBinding> get(String name) {
    return Optional.ofNullable(bindings.get(name));
  }

  public Collection<SinkBinding> all() {
    return bindings.values();
  }

  public int size() {
    return bindings.size();
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Closes every sink once; later calls return {@code false} and do nothing.
   *
   * @return {@code true} if this call performed the close
   */
  public boolean closeAll() {
    if (!closed.compareAndSet(false, true)) {
      return false;
    }
    for (SinkBinding binding : bindings.values()) {
      try {
        binding.close();
      } catch (SinkWriteException ex) {
        log.warn("Failed to close sink {}", binding.name(), ex);
      }
    }
    log.debug("Closed {} sinks", bindings.size());
    return true;
  }
}
