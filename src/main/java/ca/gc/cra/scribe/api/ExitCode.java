package ca.gc.cra.scribe.api;

/**
 * Process exit codes returned by the {@code scribe} command line.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A log sink could not be opened or written. */
  IO_ERROR(3),
  /** Logging configuration was malformed (unknown environment, bad YAML, bad limits). */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}
