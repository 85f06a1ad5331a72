package ca.gc.cra.scribe.diagnostics;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts the verbosity of SCRIBE's own diagnostics (sink failures, rotation, caching).
 * <p><strong>Why:</strong> Operators troubleshooting a silent sink can surface the pipeline's internal
 * reports without editing Logback files.</p>
 * <p><strong>Role:</strong> Adapter utility invoked by the CLI {@code --verbose} flag.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded bootstrap.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their defaults.
 * @since 0.1.0
 */
public final class DiagnosticsConfigurator {
  /** Logger namespace used by every SCRIBE class for internal diagnostics. */
  public static final String NAMESPACE = "ca.gc.cra.scribe";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(DiagnosticsConfigurator.class);

  private DiagnosticsConfigurator() {
    // Utility
  }

  /**
   * Elevates the {@value #NAMESPACE} logger to DEBUG.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseDiagnostics() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger namespace = context.getLogger(NAMESPACE);
      if (!Level.DEBUG.equals(namespace.getLevel())) {
        namespace.setLevel(Level.DEBUG);
      }
      return true;
    }
    log.warn("Verbose diagnostics requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
