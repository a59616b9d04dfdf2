package ca.gc.cra.funnel.application.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.funnel.config.ChannelSpec;
import ca.gc.cra.funnel.config.LoggingConfig;
import ca.gc.cra.funnel.config.SinkSpec;
import ca.gc.cra.funnel.domain.log.Severity;
import ca.gc.cra.funnel.testing.CollectingSink;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ChannelRegistryTest {
  private final SinkBinding console = binding("console", Severity.DEBUG);
  private final SinkBinding audit = binding("audit", Severity.INFO);
  private final SinkSet sinks = new SinkSet(List.of(console, audit));
  private final LoggingConfig base = LoggingConfig.of(List.of(
      SinkSpec.console("console", Severity.DEBUG), SinkSpec.console("audit", Severity.INFO)));

  @Test
  void effectiveLevelComesFromNearestConfiguredAncestor() {
    LoggingConfig config = base
        .withRoot(new ChannelSpec(ChannelSpec.ROOT, Severity.WARNING, false, List.of("console")))
        .withChannel(new ChannelSpec("app", Severity.DEBUG, true, List.of()));
    ChannelRegistry registry = new ChannelRegistry(config, sinks);

    assertEquals(Severity.DEBUG, registry.effectiveLevel("app"));
    assertEquals(Severity.DEBUG, registry.effectiveLevel("app.sub.deeper"));
    assertEquals(Severity.WARNING, registry.effectiveLevel("other"));
    assertTrue(registry.isEnabled("app.sub", Severity.DEBUG));
    assertFalse(registry.isEnabled("other", Severity.INFO));
  }

  @Test
  void routeCollectsAncestorSinksWithoutDuplicates() {
    LoggingConfig config = base
        .withRoot(new ChannelSpec(ChannelSpec.ROOT, Severity.INFO, false, List.of("console")))
        .withChannel(new ChannelSpec("app", null, true, List.of("audit", "console")));
    ChannelRegistry registry = new ChannelRegistry(config, sinks);

    assertEquals(List.of("audit", "console"), names(registry.route("app.sub")));
    assertEquals(List.of("console"), names(registry.route("elsewhere")));
  }

  @Test
  void propagationStopsAtNonPropagatingChannel() {
    LoggingConfig config = base
        .withRoot(new ChannelSpec(ChannelSpec.ROOT, Severity.INFO, false, List.of("console")))
        .withChannel(new ChannelSpec("app", null, false, List.of("audit")));
    ChannelRegistry registry = new ChannelRegistry(config, sinks);

    assertEquals(List.of("audit"), names(registry.route("app.worker")));
  }

  @Test
  void rootWithoutHandlerListReceivesEverySink() {
    ChannelRegistry registry = new ChannelRegistry(base, sinks);

    assertEquals(List.of("console", "audit"), names(registry.route("anything")));
  }

  @Test
  void handlersThatWereNotBuiltAreSkipped() {
    SinkSet partial = new SinkSet(List.of(console));
    LoggingConfig config = base.withRoot(
        new ChannelSpec(ChannelSpec.ROOT, Severity.INFO, false, List.of("console", "audit")));

    assertEquals(List.of("console"), names(new ChannelRegistry(config, partial).route("app")));
  }

  @Test
  void attachSetsLevelUnlessConfigured() {
    LoggingConfig config = base.withChannel(new ChannelSpec("db", Severity.ERROR, true, List.of()));
    ChannelRegistry registry = new ChannelRegistry(config, sinks);

    assertEquals(Severity.INFO, registry.effectiveLevel("api"));
    assertEquals("api", registry.attach("api", Severity.DEBUG));
    registry.attach("db", Severity.DEBUG);
    registry.attach("db.pool", Severity.DEBUG);

    assertEquals(Severity.DEBUG, registry.effectiveLevel("api.v1"));
    assertEquals(Severity.ERROR, registry.effectiveLevel("db"));
    assertEquals(Severity.ERROR, registry.effectiveLevel("db.pool"));
    assertTrue(registry.channelNames().contains("api"));
  }

  @Test
  void configuredRootLevelWinsOverDefaultLevel() {
    LoggingConfig config =
        base.withRoot(new ChannelSpec(ChannelSpec.ROOT, Severity.WARNING, false, List.of("console")));
    ChannelRegistry registry = new ChannelRegistry(config, sinks);

    registry.attach("app", Severity.DEBUG);

    assertEquals(Severity.WARNING, registry.effectiveLevel("app"));
    assertFalse(registry.isEnabled("app", Severity.DEBUG));
  }

  @Test
  void blankNamesMeanRoot() {
    assertEquals("root", ChannelRegistry.normalize(null));
    assertEquals("root", ChannelRegistry.normalize("  "));
    assertEquals("app.sub", ChannelRegistry.normalize(" app.sub "));
    assertThrows(IllegalArgumentException.class, () -> ChannelRegistry.normalize("app..sub"));
  }

  @Test
  void parentOfWalksDottedNames() {
    assertEquals("app", ChannelRegistry.parentOf("app.sub"));
    assertEquals("root", ChannelRegistry.parentOf("app"));
    assertNull(ChannelRegistry.parentOf("root"));
  }

  private static SinkBinding binding(String name, Severity level) {
    return new SinkBinding(name, new CollectingSink(), level, record -> record.message());
  }

  private static List<String> names(List<SinkBinding> bindings) {
    return bindings.stream().map(SinkBinding::name).collect(Collectors.toList());
  }
}
