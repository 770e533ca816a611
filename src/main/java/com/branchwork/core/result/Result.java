package com.branchwork.core.result;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Either a value or an {@link OrchestrationError}. Public operations of the core return this
 * instead of throwing, so failures can be inspected and recorded like any other data.
 *
 * @param <T> the success type
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(OrchestrationError error) {
        return new Failure<>(error);
    }

    static <T> Result<T> failure(ErrorCode code, String message) {
        return new Failure<>(OrchestrationError.of(code, message));
    }

    /** Convenience for operations with nothing to return. */
    static Result<Void> ok() {
        return new Success<>(null);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * @throws NoSuchElementException if this is a failure
     */
    T value();

    /**
     * @throws NoSuchElementException if this is a success
     */
    OrchestrationError error();

    default Optional<T> toOptional() {
        return isSuccess() ? Optional.ofNullable(value()) : Optional.empty();
    }

    default T orElse(T fallback) {
        return isSuccess() ? value() : fallback;
    }

    @SuppressWarnings("unchecked")
    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (isSuccess()) {
            return new Success<>(mapper.apply(value()));
        }
        return (Result<U>) this;
    }

    @SuppressWarnings("unchecked")
    default <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (isSuccess()) {
            return Objects.requireNonNull(mapper.apply(value()), "flatMap returned null");
        }
        return (Result<U>) this;
    }

    default Result<T> ifSuccess(Consumer<? super T> action) {
        if (isSuccess()) {
            action.accept(value());
        }
        return this;
    }

    default Result<T> ifFailure(Consumer<OrchestrationError> action) {
        if (isFailure()) {
            action.accept(error());
        }
        return this;
    }

    record Success<T>(T value) implements Result<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public OrchestrationError error() {
            throw new NoSuchElementException("Success has no error");
        }
    }

    record Failure<T>(OrchestrationError error) implements Result<T> {

        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T value() {
            throw new NoSuchElementException("Failure has no value: " + error);
        }
    }
}
