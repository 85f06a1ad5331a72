package ca.gc.cra.scribe.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Time source for record timestamps, date rotation and elapsed-time measurement.
 * <p><strong>Why:</strong> Wall-clock and monotonic readings are kept apart: timestamps and midnight rollover use
 * {@link #now()}, while durations use {@link #monotonicNanos()} so clock adjustments never skew them.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent reads.</p>
 *
 * @implNote {@link #SYSTEM} delegates to {@link Instant#now()} and {@link System#nanoTime()}.
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current wall-clock instant.
   *
   * @return current instant in UTC
   */
  Instant now();

  /**
   * Returns a monotonic reading in nanoseconds; only differences between readings are meaningful.
   *
   * @return monotonic nanoseconds
   */
  long monotonicNanos();

  /** Default clock backed by the JVM. */
  ClockPort SYSTEM = new ClockPort() {
    @Override
    public Instant now() {
      return Instant.now();
    }

    @Override
    public long monotonicNanos() {
      return System.nanoTime();
    }
  };
}
