/**
 * <strong>Purpose:</strong> Record model of the SCRIBE logging pipeline.
 * <p><strong>Pipeline role:</strong> Values produced by the orchestrator and consumed by filters, formatters
 * and handlers.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share between threads.
 * <p><strong>Security:</strong> Records may carry sensitive caller fields until the redaction filter runs;
 * never render a record that bypassed the filter chain.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.domain.log;
