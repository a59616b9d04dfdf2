/**
 * Topology resolution for logger facades.
 *
 * @since 0.1.0
 */
package ca.gc.cra.funnel.application.mode;
