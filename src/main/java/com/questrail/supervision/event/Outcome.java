package com.questrail.supervision.event;

import java.util.Objects;
import java.util.concurrent.ExecutionException;

/**
 * Outcome
 * -----------------------------------------------------------------------------
 * The result a {@link DataEvent} was resolved with: either a value or a
 * failure.
 *
 * <p>
 * The two cases are distinct types so that callers can tell "resolved with a
 * failure" from "resolved with a value" without catching anything.
 * </p>
 *
 * @param <T> value type
 */
public sealed interface Outcome<T>
        permits Outcome.Value, Outcome.Failure
{
    /**
     * @return the value, or throws {@link ExecutionException} wrapping the failure
     */
    T get() throws ExecutionException;

    boolean isFailure();

    static <T> Outcome<T> value(T value) {
        return new Value<>(value);
    }

    static <T> Outcome<T> failure(Throwable failure) {
        return new Failure<>(failure);
    }

    /**
     * Resolved with a value. The value may be {@code null}.
     */
    record Value<T>(T value) implements Outcome<T> {
        @Override
        public T get() {
            return value;
        }

        @Override
        public boolean isFailure() {
            return false;
        }
    }

    /**
     * Resolved with a failure.
     */
    record Failure<T>(Throwable failure) implements Outcome<T> {
        public Failure {
            Objects.requireNonNull(failure, "failure");
        }

        @Override
        public T get() throws ExecutionException {
            throw new ExecutionException(failure);
        }

        @Override
        public boolean isFailure() {
            return true;
        }
    }
}
