package com.questrail.edgecontrol.time;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of an asynchronous operation raced against a deadline.
 *
 * <p>A timeout is a value, not an exception: callers decide whether it means
 * "inactive", "use the fallback" or "activate failsafe".</p>
 *
 * @param <T> value type of a completed operation
 */
public sealed interface FetchResult<T> {

    record Completed<T>(T value) implements FetchResult<T> {}

    record TimedOut<T>(Duration bound) implements FetchResult<T> {
        public TimedOut {
            Objects.requireNonNull(bound, "bound");
        }
    }

    record Failed<T>(Throwable cause) implements FetchResult<T> {
        public Failed {
            Objects.requireNonNull(cause, "cause");
        }
    }

    static <T> FetchResult<T> completed(T value) {
        return new Completed<>(value);
    }

    static <T> FetchResult<T> timedOut(Duration bound) {
        return new TimedOut<>(bound);
    }

    static <T> FetchResult<T> failed(Throwable cause) {
        return new Failed<>(cause);
    }

    default boolean isTimedOut() {
        return this instanceof TimedOut;
    }
}
