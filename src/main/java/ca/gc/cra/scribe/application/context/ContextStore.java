package ca.gc.cra.scribe.application.context;

import ca.gc.cra.scribe.domain.log.Fields;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Thread-scoped stack of context frames merged into every record.
 * <p><strong>Why:</strong> Request identifiers and similar fields must reach every record produced inside a
 * scope's dynamic extent without threading them through each call, and must vanish when the scope ends.</p>
 * <p><strong>Role:</strong> Application service consulted by the orchestrator at record construction.</p>
 * <p><strong>Semantics:</strong>
 * <ul>
 *   <li>{@link #enter(Map)} pushes a frame; {@link ContextScope#close()} pops it.</li>
 *   <li>{@link #current()} deep-merges frames outermost first, so inner frames shadow outer keys and nested
 *   maps merge leaf by leaf.</li>
 *   <li>Exiting an inner frame restores the outer binding exactly.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each thread owns its own stack; threads never observe each other's frames.
 * Use {@link #wrap(Runnable)} to carry a snapshot onto a worker thread.</p>
 *
 * @since 0.1.0
 */
public final class ContextStore {
  private static final Logger log = LoggerFactory.getLogger(ContextStore.class);
  private static final ContextStore SHARED = new ContextStore();

  private final ThreadLocal<Deque<ContextScope>> frames = new ThreadLocal<>();

  /**
   * Returns the process-wide store used by {@link LogContext} and by loggers built without an explicit store.
   *
   * @return shared store
   */
  public static ContextStore shared() {
    return SHARED;
  }

  /**
   * Pushes a frame for the calling thread.
   *
   * @param fields fields visible until the returned scope closes; {@code null} enters an empty frame
   * @return scope token to close on exit
   */
  public ContextScope enter(Map<String, ?> fields) {
    ContextScope scope = new ContextScope(this, Fields.copyOf(fields), Thread.currentThread());
    Deque<ContextScope> stack = frames.get();
    if (stack == null) {
      stack = new ArrayDeque<>();
      frames.set(stack);
    }
    stack.push(scope);
    return scope;
  }

  /**
   * Pops {@code scope} and any frames entered after it on the calling thread.
   *
   * @param scope token returned by {@link #enter(Map)}; unknown or already-closed tokens are ignored
   */
  public void exit(ContextScope scope) {
    if (scope == null || scope.isClosed()) {
      return;
    }
    if (scope.owner() != Thread.currentThread()) {
      log.debug("Ignoring context exit from thread {} for a frame owned by {}",
          Thread.currentThread().getName(), scope.owner().getName());
      return;
    }
    Deque<ContextScope> stack = frames.get();
    if (stack == null || !stack.contains(scope)) {
      scope.markClosed();
      return;
    }
    while (!stack.isEmpty()) {
      ContextScope top = stack.pop();
      top.markClosed();
      if (top == scope) {
        break;
      }
      log.debug("Closing context frame left open inside an exiting scope");
    }
    if (stack.isEmpty()) {
      frames.remove();
    }
  }

  /**
   * Returns the merged context of the calling thread.
   *
   * @return unmodifiable merged snapshot; empty when no frame is active
   */
  public Map<String, Object> current() {
    Deque<ContextScope> stack = frames.get();
    if (stack == null || stack.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> merged = new LinkedHashMap<>();
    Iterator<ContextScope> outermostFirst = stack.descendingIterator();
    while (outermostFirst.hasNext()) {
      deepMerge(merged, outermostFirst.next().fields());
    }
    return Collections.unmodifiableMap(merged);
  }

  /**
   * Returns the number of open frames on the calling thread.
   *
   * @return frame depth
   */
  public int depth() {
    Deque<ContextScope> stack = frames.get();
    return stack == null ? 0 : stack.size();
  }

  /**
   * Captures the caller's merged context and replays it around {@code task} on whichever thread runs it.
   *
   * @param task task to decorate; must not be {@code null}
   * @return decorated task
   */
  public Runnable wrap(Runnable task) {
    Map<String, Object> snapshot = current();
    return () -> {
      try (ContextScope ignored = enter(snapshot)) {
        task.run();
      }
    };
  }

  /**
   * Callable variant of {@link #wrap(Runnable)}.
   *
   * @param task task to decorate; must not be {@code null}
   * @param <T> result type
   * @return decorated task
   */
  public <T> Callable<T> wrap(Callable<T> task) {
    Map<String, Object> snapshot = current();
    return () -> {
      try (ContextScope ignored = enter(snapshot)) {
        return task.call();
      }
    };
  }

  private static void deepMerge(Map<String, Object> target, Map<String, Object> source) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      target.put(entry.getKey(), mergeValue(target.get(entry.getKey()), entry.getValue()));
    }
  }

  private static Object mergeValue(Object existing, Object incoming) {
    if (existing instanceof Map<?, ?> outer && incoming instanceof Map<?, ?> inner) {
      Map<Object, Object> nested = new LinkedHashMap<>(outer);
      for (Map.Entry<?, ?> entry : inner.entrySet()) {
        nested.put(entry.getKey(), mergeValue(nested.get(entry.getKey()), entry.getValue()));
      }
      return Collections.unmodifiableMap(nested);
    }
    return incoming;
  }
}
