package ca.gc.cra.scribe.application.logger;

import ca.gc.cra.scribe.domain.log.Origin;
import java.util.Set;

/**
 * Finds the first stack frame outside the logger implementation.
 *
 * @since 0.1.0
 */
final class CallSiteResolver {
  private static final StackWalker WALKER = StackWalker.getInstance();
  private static final Set<String> INTERNAL = Set.of(
      AppLogger.class.getName(),
      RecordFactory.class.getName(),
      CallSiteResolver.class.getName());

  private CallSiteResolver() {}

  static Origin resolve() {
    return WALKER.walk(frames -> frames
        .filter(frame -> !INTERNAL.contains(frame.getClassName()))
        .findFirst()
        .map(frame -> new Origin(frame.getClassName(), frame.getMethodName(), frame.getLineNumber()))
        .orElse(Origin.UNKNOWN));
  }
}
