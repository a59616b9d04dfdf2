/**
 * Helpers for the library's own SLF4J diagnostics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.funnel.logging;
