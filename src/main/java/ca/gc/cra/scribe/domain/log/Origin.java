package ca.gc.cra.scribe.domain.log;

/**
 * Call site that produced a {@link LogRecord}.
 *
 * @param module fully qualified class name of the caller
 * @param function method name of the caller
 * @param line source line, or {@code -1} when the class was compiled without line tables
 * @since 0.1.0
 */
public record Origin(String module, String function, int line) {
  private static final String UNKNOWN_NAME = "unknown";

  /** Placeholder used when the call site cannot be resolved. */
  public static final Origin UNKNOWN = new Origin(UNKNOWN_NAME, UNKNOWN_NAME, -1);

  public Origin {
    module = module == null || module.isBlank() ? UNKNOWN_NAME : module;
    function = function == null || function.isBlank() ? UNKNOWN_NAME : function;
  }
}
