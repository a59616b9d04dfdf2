/**
 * Input validation helpers shared by configuration parsing and the public API.
 * <p><strong>Concurrency:</strong> Stateless; thread-safe.</p>
 * <p><strong>Security:</strong> Rejects control characters so configured names cannot inject line breaks into log output.</p>
 */
package ca.gc.cra.funnel.validation;
