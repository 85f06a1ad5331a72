package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.application.port.ClockPort;
import ca.gc.cra.scribe.application.port.MetricsPort;
import java.io.OutputStream;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Runtime collaborators a {@link HandlerSpec} needs to open its handler.
 *
 * @param metrics metrics sink shared by handlers
 * @param clock wall clock used by date rotation
 * @param zone zone for human-readable timestamps and midnight rotation
 * @param console stream console handlers write to
 * @since 0.1.0
 */
public record HandlerContext(MetricsPort metrics, ClockPort clock, ZoneId zone, OutputStream console) {
  public HandlerContext {
    metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(zone, "zone");
    Objects.requireNonNull(console, "console");
  }

  /**
   * Returns a context writing to {@code System.out} with the system clock, system zone and no metrics.
   *
   * @return default context
   */
  public static HandlerContext defaults() {
    return new HandlerContext(MetricsPort.NO_OP, ClockPort.SYSTEM, ZoneId.systemDefault(), System.out);
  }

  /**
   * Returns a copy using {@code replacement} for metrics.
   *
   * @param replacement metrics sink
   * @return new context
   */
  public HandlerContext withMetrics(MetricsPort replacement) {
    return new HandlerContext(replacement, clock, zone, console);
  }
}
