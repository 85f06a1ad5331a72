package ca.gc.cra.scribe.application.context;

import java.util.Map;

/**
 * Token for one entered context frame.
 * <p>Closing the scope pops its frame (and any frames entered after it that were left open) from the owning
 * thread's stack. Closing is idempotent and a no-op on any thread other than the one that entered it, so
 * try-with-resources restores the parent context on every exit path.</p>
 *
 * @since 0.1.0
 */
public final class ContextScope implements AutoCloseable {
  private final ContextStore store;
  private final Map<String, Object> fields;
  private final Thread owner;
  private boolean closed;

  ContextScope(ContextStore store, Map<String, Object> fields, Thread owner) {
    this.store = store;
    this.fields = fields;
    this.owner = owner;
  }

  /**
   * Returns the fields this frame contributes.
   *
   * @return unmodifiable frame fields
   */
  public Map<String, Object> fields() {
    return fields;
  }

  /**
   * Returns whether the frame has been exited.
   *
   * @return {@code true} once closed
   */
  public boolean isClosed() {
    return closed;
  }

  Thread owner() {
    return owner;
  }

  void markClosed() {
    closed = true;
  }

  @Override
  public void close() {
    store.exit(this);
  }
}
