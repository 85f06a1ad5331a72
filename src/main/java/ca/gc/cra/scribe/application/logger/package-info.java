/**
 * <strong>Purpose:</strong> Logger orchestrator and its helpers: record construction, call-site resolution and
 * the filter chain.
 * <p><strong>Pipeline role:</strong> Entry point of the pipeline; builds records and fans them out to handlers.
 * <p><strong>Concurrency:</strong> Every call completes synchronously on the caller's thread.
 * <p><strong>Failure policy:</strong> Logging never throws to callers; {@code measureTime} rethrows only the
 * caller's own failure.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.application.logger;
