/**
 * Logging configuration: document loading (SnakeYAML, Jackson) and the validated records built from it.
 * <p><strong>Role:</strong> Bootstrap layer read once per facade.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> YAML is parsed with SnakeYAML's safe constructor; names are validated through
 * {@code ca.gc.cra.funnel.validation}.</p>
 */
package ca.gc.cra.funnel.config;
