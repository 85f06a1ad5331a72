package ca.gc.cra.scribe.application.logger;

/**
 * Unit of work timed by {@link AppLogger#measureTime(String, CheckedRunnable)}.
 *
 * @param <E> checked failure type propagated unchanged to the caller
 * @since 0.1.0
 */
@FunctionalInterface
public interface CheckedRunnable<E extends Throwable> {
  /**
   * Runs the work.
   *
   * @throws E when the work fails
   */
  void run() throws E;
}
