/**
 * Thread and executor construction for the collector and pipe readers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.funnel.infrastructure.exec;
