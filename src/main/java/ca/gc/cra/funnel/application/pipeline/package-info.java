/**
 * The collector that drains the shared record channel into the owner's sinks.
 * <p><strong>Concurrency:</strong> One collector thread per aggregation owner.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.funnel.application.pipeline;
