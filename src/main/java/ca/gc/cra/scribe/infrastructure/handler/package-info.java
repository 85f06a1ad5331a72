/**
 * <strong>Purpose:</strong> Sink-owning handler adapters: console stream, size-rotating file and daily-rotating
 * file.
 * <p><strong>Pipeline role:</strong> Last stage; applies the handler threshold, renders with its formatter and
 * writes one line per record.
 * <p><strong>Concurrency:</strong> Writes and rotation run under a per-handler lock.
 * <p><strong>Failure policy:</strong> Sink failures are logged through SLF4J and counted, never thrown to callers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.infrastructure.handler;
