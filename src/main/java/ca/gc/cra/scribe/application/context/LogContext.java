package ca.gc.cra.scribe.application.context;

import ca.gc.cra.scribe.domain.log.Fields;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Static entry points over {@link ContextStore#shared()}.
 *
 * <pre>{@code
 * try (ContextScope scope = LogContext.with("request_id", "abc-123")) {
 *   log.info("Processing request");
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class LogContext {
  /** Context key carrying the request identifier. */
  public static final String REQUEST_ID = "request_id";
  /** Context key carrying the authenticated user identifier. */
  public static final String USER_ID = "user_id";

  private LogContext() {
    // Utility
  }

  /**
   * Enters a frame built from alternating {@code key, value} arguments.
   *
   * @param keyValues alternating keys and values; malformed pairs are dropped
   * @return scope to close on exit
   */
  public static ContextScope with(Object... keyValues) {
    return ContextStore.shared().enter(Fields.of(keyValues));
  }

  /**
   * Enters a frame with the supplied fields.
   *
   * @param fields frame fields
   * @return scope to close on exit
   */
  public static ContextScope with(Map<String, ?> fields) {
    return ContextStore.shared().enter(fields);
  }

  /**
   * Enters a request frame binding {@value #REQUEST_ID} and, when present, {@value #USER_ID}.
   *
   * @param requestId request identifier; a random UUID is generated when blank
   * @param userId user identifier; omitted when blank
   * @return scope to close when the request completes
   */
  public static ContextScope forRequest(String requestId, String userId) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put(REQUEST_ID, requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId);
    if (userId != null && !userId.isBlank()) {
      fields.put(USER_ID, userId);
    }
    return ContextStore.shared().enter(fields);
  }

  /**
   * Returns the calling thread's merged context.
   *
   * @return merged snapshot
   */
  public static Map<String, Object> current() {
    return ContextStore.shared().current();
  }

  /**
   * Carries the caller's context onto the thread that runs {@code task}.
   *
   * @param task task to decorate
   * @return decorated task
   */
  public static Runnable wrap(Runnable task) {
    return ContextStore.shared().wrap(task);
  }

  /**
   * Carries the caller's context onto the thread that runs {@code task}.
   *
   * @param task task to decorate
   * @param <T> result type
   * @return decorated task
   */
  public static <T> Callable<T> wrap(Callable<T> task) {
    return ContextStore.shared().wrap(task);
  }
}
