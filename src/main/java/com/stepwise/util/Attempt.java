package com.stepwise.util;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The outcome of a computation that may have failed with an unchecked exception.
 * <p>
 * Used where a failed transformation should fall back to an earlier value instead of aborting the
 * whole pipeline. The failure is kept as a value so the caller decides how to report it.
 * </p>
 *
 * @param <T> The type of the successful value.
 */
public sealed interface Attempt<T> permits Attempt.Success, Attempt.Failure {

    record Success<T>(T value) implements Attempt<T> {
    }

    record Failure<T>(RuntimeException error) implements Attempt<T> {

        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }

    /**
     * Runs {@code action} and captures either its result or the runtime exception it threw.
     */
    static <T> Attempt<T> of(Supplier<T> action) {
        try {
            return new Success<>(action.get());
        } catch (RuntimeException e) {
            return new Failure<>(e);
        }
    }

    /**
     * @return The successful value, or the value computed from the failure.
     */
    default T recover(Function<RuntimeException, ? extends T> fallback) {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        return fallback.apply(((Failure<T>) this).error());
    }
}
