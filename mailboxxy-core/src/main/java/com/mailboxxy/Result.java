package com.mailboxxy;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Result of waiting on a reply, for explicit error handling without exceptions.
 * Sealed so the two outcomes are exhaustive.
 *
 * @param <T> the reply value type
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    /**
     * Successful result containing a value.
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElse(Function<Throwable, T> fn) {
            return value;
        }
    }

    /**
     * Failed result containing an error.
     */
    record Failure<T>(Throwable error) implements Result<T> {
        public Failure {
            Objects.requireNonNull(error, "error cannot be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            if (error instanceof RuntimeException re) {
                throw re;
            }
            throw new ReplyException("Reply failed", error);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElse(Function<Throwable, T> fn) {
            return fn.apply(error);
        }
    }

    boolean isSuccess();

    T getOrThrow();

    T getOrElse(T defaultValue);

    T getOrElse(Function<Throwable, T> fn);

    /**
     * Returns true if this result failed because the reply channel closed without a value.
     */
    default boolean isChannelClosed() {
        return this instanceof Failure<T> failure && failure.error() instanceof ChannelClosedException;
    }

    default <U> Result<U> map(Function<T, U> fn) {
        if (this instanceof Success<T> success) {
            try {
                return new Success<>(fn.apply(success.value()));
            } catch (Exception e) {
                return new Failure<>(e);
            }
        }
        return new Failure<>(((Failure<T>) this).error());
    }

    default Result<T> recover(Function<Throwable, T> fn) {
        if (this instanceof Failure<T> failure) {
            try {
                return new Success<>(fn.apply(failure.error()));
            } catch (Exception e) {
                return new Failure<>(e);
            }
        }
        return this;
    }

    default void ifSuccess(Consumer<T> consumer) {
        if (this instanceof Success<T> success) {
            consumer.accept(success.value());
        }
    }

    default void ifFailure(Consumer<Throwable> consumer) {
        if (this instanceof Failure<T> failure) {
            consumer.accept(failure.error());
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Throwable error) {
        return new Failure<>(error);
    }
}
