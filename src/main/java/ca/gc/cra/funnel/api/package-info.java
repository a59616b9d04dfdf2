/**
 * Public entry points: {@link ca.gc.cra.funnel.api.LoggerFacade}, its {@link ca.gc.cra.funnel.api.Channel}s, and
 * construction options.
 *
 * @since 0.1.0
 */
package ca.gc.cra.funnel.api;
