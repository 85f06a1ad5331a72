/**
 * <strong>Purpose:</strong> Validation helpers applied to configuration values before sinks are opened.
 * <p><strong>Concurrency:</strong> Stateless utilities.
 * <p><strong>Observability:</strong> Failures raise {@link java.lang.IllegalArgumentException}; nothing is logged.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.validation;
