/**
 * <strong>Purpose:</strong> Scope-local log context: nested frames merged into every record.
 * <p><strong>Concurrency:</strong> One frame stack per thread; {@link
 * ca.gc.cra.scribe.application.context.ContextStore#wrap(Runnable)} and {@link
 * ca.gc.cra.scribe.application.context.ContextPropagatingExecutor} copy a snapshot across thread hand-offs.
 * <p><strong>Lifecycle:</strong> Frames are closed with try-with-resources so every exit path restores the parent
 * context.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.application.context;
