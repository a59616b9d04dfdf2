/**
 * Record channel implementations: the in-memory queue used between threads and the JSON-lines transport
 * used between JVMs over local pipes.
 * <p><strong>Concurrency:</strong> The queue accepts many producers and one consumer.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.funnel.infrastructure.channel;
