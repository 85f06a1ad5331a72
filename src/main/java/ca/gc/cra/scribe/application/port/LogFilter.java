package ca.gc.cra.scribe.application.port;

import ca.gc.cra.scribe.domain.log.LogRecord;

/**
 * <strong>What:</strong> Pipeline stage that vetoes or sanitizes a {@link LogRecord} before formatting.
 * <p><strong>Why:</strong> Deployments add organization-specific suppression or redaction rules by registering
 * new stages, never by editing the orchestrator.</p>
 * <p><strong>Role:</strong> Port implemented by adapters such as {@code LevelFilter} and
 * {@code SensitiveDataFilter}; stages run in registration order.</p>
 * <p><strong>Thread-safety:</strong> Implementations are shared by every thread logging through the same
 * logger and must be safe for concurrent use.</p>
 * <p><strong>Identity:</strong> Implementations should define {@code equals}/{@code hashCode} over their
 * configuration; logger caching compares filter lists when deciding whether a configuration is compatible.</p>
 *
 * @since 0.1.0
 */
public interface LogFilter {
  /**
   * Evaluates one record.
   *
   * @param record record produced by the orchestrator or by a previous stage; never {@code null}
   * @return decision carrying the (possibly sanitized) record; {@link FilterDecision#drop(LogRecord)} stops the
   *     chain
   */
  FilterDecision apply(LogRecord record);

  /**
   * Outcome of a {@link LogFilter} stage.
   *
   * @param keep {@code false} to suppress the record and skip remaining stages
   * @param record record to hand to the next stage; never {@code null}
   */
  record FilterDecision(boolean keep, LogRecord record) {
    /**
     * Keeps the supplied record.
     *
     * @param record record to forward
     * @return keep decision
     */
    public static FilterDecision keep(LogRecord record) {
      return new FilterDecision(true, record);
    }

    /**
     * Suppresses the supplied record.
     *
     * @param record record being vetoed
     * @return drop decision
     */
    public static FilterDecision drop(LogRecord record) {
      return new FilterDecision(false, record);
    }
  }
}
