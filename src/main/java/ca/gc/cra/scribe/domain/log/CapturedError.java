package ca.gc.cra.scribe.domain.log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * <strong>What:</strong> Data snapshot of an application {@link Throwable} attached to a record.
 * <p><strong>Why:</strong> Records must stay immutable and renderable long after the failing frame
 * unwinds, so the error is copied into plain strings instead of holding the live exception.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param type fully qualified exception class name
 * @param message exception message, or {@code null} when none was supplied
 * @param frames rendered stack frames, innermost first
 * @param cause captured cause chain, or {@code null} at the root
 * @since 0.1.0
 */
public record CapturedError(String type, String message, List<String> frames, CapturedError cause) {
  private static final int MAX_CAUSE_DEPTH = 8;

  public CapturedError {
    type = type == null || type.isBlank() ? "java.lang.Throwable" : type;
    frames = frames == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(frames));
  }

  /**
   * Copies the supplied throwable and its cause chain.
   *
   * @param error throwable to snapshot; may be {@code null}
   * @return captured error, or {@code null} when {@code error} is {@code null}
   */
  public static CapturedError from(Throwable error) {
    if (error == null) {
      return null;
    }
    return capture(error, Collections.newSetFromMap(new IdentityHashMap<>()), 0);
  }

  private static CapturedError capture(Throwable error, Set<Throwable> seen, int depth) {
    seen.add(error);
    List<String> frames = new ArrayList<>();
    for (StackTraceElement element : error.getStackTrace()) {
      frames.add(element.toString());
    }
    Throwable next = error.getCause();
    CapturedError cause = null;
    // cause chains may be cyclic
    if (next != null && !seen.contains(next) && depth < MAX_CAUSE_DEPTH) {
      cause = capture(next, seen, depth + 1);
    }
    return new CapturedError(error.getClass().getName(), error.getMessage(), frames, cause);
  }
}
