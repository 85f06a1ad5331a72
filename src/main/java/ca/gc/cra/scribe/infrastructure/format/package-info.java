/**
 * <strong>Purpose:</strong> Formatter adapters turning filtered records into text entries.
 * <p><strong>Pipeline role:</strong> Owned by handlers; {@code JsonFormatter} for machine consumers and
 * {@code ConsoleFormatter} for people reading a terminal.
 * <p><strong>Concurrency:</strong> Formatters are immutable and shared across threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.infrastructure.format;
