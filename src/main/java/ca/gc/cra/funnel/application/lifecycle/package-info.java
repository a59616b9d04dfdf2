/**
 * Start-up and idempotent shutdown of the logging pipeline.
 *
 * @since 0.1.0
 */
package ca.gc.cra.funnel.application.lifecycle;
