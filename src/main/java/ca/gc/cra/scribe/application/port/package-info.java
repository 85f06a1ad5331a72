/**
 * Capability interfaces of the logging pipeline: filters, formatters, handlers, clock and metrics.
 * <p><strong>Extension:</strong> new variants are added by implementing a port and registering the instance in a
 * {@code LoggerConfig}; the orchestrator only depends on these interfaces.
 * <p><strong>Concurrency:</strong> Every implementation is shared across logging threads.
 */
package ca.gc.cra.scribe.application.port;
