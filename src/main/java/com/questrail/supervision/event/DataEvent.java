package com.questrail.supervision.event;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * DataEvent
 * -----------------------------------------------------------------------------
 * A single-assignment, multi-waiter event carrying either a value or a
 * failure.
 *
 * <h2>Resolution cycles</h2>
 * An event starts unresolved. Exactly one producer call to
 * {@link #resolve(Object)} or {@link #resolveWithFailure(Throwable)} resolves
 * the current cycle; every further attempt fails with
 * {@link EventAlreadyResolvedException} until {@link #reset()} starts a new
 * cycle.
 *
 * <h2>Waiters</h2>
 * Any number of threads may {@link #await()} a cycle, before or after it
 * resolves, and all of them observe the same {@link Outcome}. A waiter is
 * bound to the cycle that was current when it started waiting:
 * <ul>
 *   <li>a waiter of a resolved cycle returns that cycle's outcome even if
 *       {@link #reset()} runs before it gets scheduled again;</li>
 *   <li>a waiter of a cycle that is reset while still unresolved never sees
 *       the next cycle's outcome. It stays blocked until interrupted or timed
 *       out; callers that reset an event own that consequence.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * State transitions happen under a single private lock. Resolution completes
 * the cycle in one step, so no waiter can observe a partially resolved event.
 * Dependent stages obtained from {@link #toCompletionStage()} are completed
 * on the resolving thread, after the lock is released.
 *
 * @param <T> value type
 */
public final class DataEvent<T>
{
    private final Object lock = new Object();

    private volatile Cycle<T> current = new Cycle<>();

    /**
     * Resolves the current cycle with a value and wakes every waiter.
     *
     * @param value the value; may be {@code null}
     * @throws EventAlreadyResolvedException if the current cycle is already resolved
     */
    public void resolve(T value) {
        complete(Outcome.value(value));
    }

    /**
     * Resolves the current cycle with a failure and wakes every waiter.
     *
     * @param failure the failure to hand to waiters (must not be {@code null})
     * @throws EventAlreadyResolvedException if the current cycle is already resolved
     */
    public void resolveWithFailure(Throwable failure) {
        Objects.requireNonNull(failure, "failure");
        complete(Outcome.failure(failure));
    }

    /**
     * Blocks until the current cycle resolves.
     *
     * @return the value the cycle was resolved with
     * @throws ExecutionException   if the cycle was resolved with a failure;
     *                              the failure is the cause
     * @throws InterruptedException if interrupted while waiting
     */
    public T await() throws InterruptedException, ExecutionException {
        return awaitOutcome().get();
    }

    /**
     * Blocks until the current cycle resolves or the timeout expires.
     *
     * @throws TimeoutException if the cycle did not resolve in time
     */
    public T await(Duration timeout) throws InterruptedException, ExecutionException, TimeoutException {
        return awaitOutcome(timeout).get();
    }

    /**
     * Blocks until the current cycle resolves and returns its outcome without
     * raising the failure.
     */
    public Outcome<T> awaitOutcome() throws InterruptedException {
        Cycle<T> cycle = current;
        cycle.resolved.await();
        return cycle.outcome;
    }

    /**
     * Timeout-bounded variant of {@link #awaitOutcome()}.
     */
    public Outcome<T> awaitOutcome(Duration timeout) throws InterruptedException, TimeoutException {
        Objects.requireNonNull(timeout, "timeout");

        Cycle<T> cycle = current;
        if (!cycle.resolved.await(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
            throw new TimeoutException("DataEvent not resolved within " + timeout);
        }
        return cycle.outcome;
    }

    /**
     * @return whether the current cycle is resolved
     */
    public boolean isResolved() {
        return current.outcome != null;
    }

    /**
     * Reads the outcome of the current cycle without blocking.
     *
     * @return the value
     * @throws EventNotResolvedException if the current cycle is not resolved
     * @throws ExecutionException        if resolved with a failure
     */
    public T peek() throws ExecutionException {
        Outcome<T> outcome = current.outcome;
        if (outcome == null) {
            throw new EventNotResolvedException("DataEvent is not resolved");
        }
        return outcome.get();
    }

    /**
     * @return the outcome of the current cycle, or empty if unresolved
     */
    public Optional<Outcome<T>> outcome() {
        return Optional.ofNullable(current.outcome);
    }

    /**
     * Discards any stored outcome and starts a new, unresolved cycle.
     * No waiter is woken.
     */
    public void reset() {
        synchronized (lock) {
            current = new Cycle<>();
        }
    }

    /**
     * Returns a stage that completes with the current cycle's value, or
     * exceptionally with its failure. The stage cannot be completed by the
     * caller.
     */
    public CompletionStage<T> toCompletionStage() {
        return current.stage.minimalCompletionStage();
    }

    @Override
    public String toString() {
        Outcome<T> outcome = current.outcome;
        if (outcome == null) {
            return "DataEvent[resolved=false]";
        }
        if (outcome instanceof Outcome.Failure<T> failure) {
            return "DataEvent[resolved=true, failure=" + failure.failure() + "]";
        }
        return "DataEvent[resolved=true, value=" + ((Outcome.Value<T>) outcome).value() + "]";
    }

    private void complete(Outcome<T> outcome) {
        final Cycle<T> cycle;

        synchronized (lock) {
            cycle = current;
            if (cycle.outcome != null) {
                throw new EventAlreadyResolvedException("DataEvent is already resolved: " + this);
            }
            cycle.outcome = outcome;
            cycle.resolved.countDown();
        }

        if (outcome instanceof Outcome.Failure<T> failure) {
            cycle.stage.completeExceptionally(failure.failure());
        } else {
            cycle.stage.complete(((Outcome.Value<T>) outcome).value());
        }
    }

    /**
     * One resolution cycle. Waiters hold on to the cycle they started
     * waiting on.
     */
    private static final class Cycle<T> {
        private final CountDownLatch resolved = new CountDownLatch(1);
        private final CompletableFuture<T> stage = new CompletableFuture<>();

        // Written once under the lock, before the latch opens.
        private volatile Outcome<T> outcome;
    }
}
