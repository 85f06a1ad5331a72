/**
 * Built-in filter stages: level threshold and key-based redaction.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.infrastructure.filter;
