/**
 * Template and date-pattern formatting of log records.
 *
 * @since 0.1.0
 */
package ca.gc.cra.funnel.infrastructure.format;
