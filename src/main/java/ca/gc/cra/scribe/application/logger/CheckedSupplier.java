package ca.gc.cra.scribe.application.logger;

/**
 * Value-producing unit of work timed by {@link AppLogger#measureTimeAndGet(String, CheckedSupplier)}.
 *
 * @param <T> result type
 * @param <E> checked failure type propagated unchanged to the caller
 * @since 0.1.0
 */
@FunctionalInterface
public interface CheckedSupplier<T, E extends Throwable> {
  /**
   * Produces the value.
   *
   * @return result
   * @throws E when the work fails
   */
  T get() throws E;
}
