/**
 * Small null-safe helpers shared across packages.
 *
 * @since 0.1.0
 */
package ca.gc.cra.funnel.util;
