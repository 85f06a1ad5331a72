/**
 * <strong>Purpose:</strong> Public entry points: the logger registry, the {@code Loggers} facade and the
 * {@code scribe} command line.
 * <p><strong>Concurrency:</strong> The registry serializes lookups and clearing.
 * <p><strong>Failure policy:</strong> Configuration errors surface from {@code get}; the CLI maps them to
 * {@link ca.gc.cra.scribe.api.ExitCode} values.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.api;
