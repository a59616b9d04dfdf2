/**
 * Hierarchical channel routing and per-sink fan-out.
 * <p><strong>Concurrency:</strong> Routing state is concurrent; each sink is written under its own lock.</p>
 * <p><strong>Observability:</strong> Sink failures are logged via SLF4J and counted through
 * {@link ca.gc.cra.funnel.application.port.MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.funnel.application.dispatch;
