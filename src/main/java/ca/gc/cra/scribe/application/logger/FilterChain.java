package ca.gc.cra.scribe.application.logger;

import ca.gc.cra.scribe.application.port.LogFilter;
import ca.gc.cra.scribe.application.port.LogFilter.FilterDecision;
import ca.gc.cra.scribe.domain.log.LogRecord;
import java.util.List;
import java.util.Objects;

/**
 * Runs filters in registration order, stopping at the first veto.
 *
 * @since 0.1.0
 */
public final class FilterChain {
  private final List<LogFilter> filters;

  /**
   * Creates a chain.
   *
   * @param filters stages in evaluation order; {@code null} elements are rejected
   */
  public FilterChain(List<? extends LogFilter> filters) {
    this.filters = List.copyOf(Objects.requireNonNull(filters, "filters"));
  }

  /**
   * Returns the stages in evaluation order.
   *
   * @return immutable list of filters
   */
  public List<LogFilter> filters() {
    return filters;
  }

  /**
   * Passes the record through every stage.
   *
   * @param record record built by the orchestrator
   * @return final decision; the carried record reflects every sanitizing stage that ran
   */
  public FilterDecision apply(LogRecord record) {
    LogRecord current = Objects.requireNonNull(record, "record");
    for (LogFilter filter : filters) {
      FilterDecision decision = filter.apply(current);
      if (decision == null) {
        throw new IllegalStateException("Filter " + filter + " returned no decision");
      }
      if (!decision.keep()) {
        return decision;
      }
      current = decision.record() == null ? current : decision.record();
    }
    return FilterDecision.keep(current);
  }
}
