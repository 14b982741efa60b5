package com.questrail.supervision.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal cancellation handle for submitted or scheduled work.
 *
 * <p>
 * Implemented by every {@link OperationScheduler} (executor-backed, Netty
 * event-loop backed, deterministic test scheduler) and by operation handles
 * themselves.
 * </p>
 */
public interface Cancellable
{
    /**
     * Request cancellation.
     *
     * @return {@code true} if cancellation was requested on work that had not
     *         yet finished; {@code false} if it had already completed or been
     *         cancelled.
     */
    boolean cancel();
}
