/**
 * <strong>Purpose:</strong> Support for SCRIBE's own diagnostics, reported through SLF4J/Logback rather than through
 * the pipeline itself, plus value truncation used by the console formatter.
 * <p><strong>Concurrency:</strong> Stateless helpers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.diagnostics;
