/**
 * Console, file, and rotating-file sinks plus the factory that builds them.
 * <p><strong>Concurrency:</strong> Sinks are single-threaded; {@code SinkBinding} serializes access.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.funnel.infrastructure.sink;
