/**
 * Domain values describing log events and the process topology they are produced under.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share.</p>
 * <p><strong>Observability:</strong> Records carry thread and process labels so aggregated output stays attributable.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.funnel.domain.log;
