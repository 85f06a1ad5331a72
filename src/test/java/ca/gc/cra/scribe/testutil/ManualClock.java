package ca.gc.cra.scribe.testutil;

import ca.gc.cra.scribe.application.port.ClockPort;
import java.time.Duration;
import java.time.Instant;

/**
 * Deterministic clock; wall and monotonic readings advance together only when told to.
 */
public final class ManualClock implements ClockPort {
  private Instant now;
  private long nanos;

  public ManualClock(Instant start) {
    this.now = start;
  }

  @Override
  public synchronized Instant now() {
    return now;
  }

  @Override
  public synchronized long monotonicNanos() {
    return nanos;
  }

  public synchronized void advance(Duration duration) {
    now = now.plus(duration);
    nanos += duration.toNanos();
  }

  public synchronized void set(Instant instant) {
    now = instant;
  }
}
