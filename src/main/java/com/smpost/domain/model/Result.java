package com.smpost.domain.model;

import java.util.function.Function;

/**
 * The outcome of a business operation: either a value or an expected error.
 * Rule violations travel as {@code Failure}; exceptions are kept for infrastructure faults.
 *
 * @param <T> the type of the success value
 * @param <E> the type of the error
 */
public sealed interface Result<T, E> permits Result.Success, Result.Failure {

    record Success<T, E>(T value) implements Result<T, E> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public E errorOrNull() {
            return null;
        }

        @Override
        public <U> Result<U, E> map(Function<T, U> mapper) {
            return new Success<>(mapper.apply(value));
        }
    }

    record Failure<T, E>(E error) implements Result<T, E> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            throw new IllegalStateException("Cannot get value from Failure: " + error);
        }

        @Override
        public E errorOrNull() {
            return error;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <U> Result<U, E> map(Function<T, U> mapper) {
            return (Result<U, E>) this;
        }
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    T getOrThrow();

    E errorOrNull();

    <U> Result<U, E> map(Function<T, U> mapper);

    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <E> Result<Void, E> done() {
        return new Success<>(null);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }
}
