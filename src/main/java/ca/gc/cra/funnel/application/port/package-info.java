/**
 * Ports separating the logging pipeline from its adapters.
 * <p><strong>Role:</strong> Channel, sink, formatter, clock, and metrics contracts consumed by the application layer.</p>
 * <p><strong>Concurrency:</strong> Each port documents its own guarantees; the channel is the only shared mutable seam.</p>
 * <p><strong>Metrics:</strong> {@link ca.gc.cra.funnel.application.port.MetricsPort} defines the {@code funnel.*} key space.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.funnel.application.port;
