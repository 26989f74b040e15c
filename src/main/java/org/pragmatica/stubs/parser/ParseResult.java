package org.pragmatica.stubs.parser;

import org.pragmatica.stubs.error.StubError;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Result of a grammar production or construction step - either a value or the
 * one error that aborts the parse.
 */
public sealed interface ParseResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Value of a successful result.
     *
     * @throws IllegalStateException if this is a failure
     */
    T unwrap();

    <R> R fold(Function<StubError, R> onFailure, Function<T, R> onSuccess);

    static <T> ParseResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ParseResult<T> failure(StubError error) {
        return new Failure<>(error);
    }

    default <U> ParseResult<U> map(Function<? super T, ? extends U> mapper) {
        return fold(ParseResult::failure, value -> success(mapper.apply(value)));
    }

    default <U> ParseResult<U> flatMap(Function<? super T, ParseResult<U>> mapper) {
        return fold(ParseResult::failure, mapper::apply);
    }

    default ParseResult<T> onSuccess(Consumer<? super T> action) {
        if (this instanceof Success<T> success) {
            action.accept(success.value());
        }
        return this;
    }

    default ParseResult<T> onFailure(Consumer<StubError> action) {
        if (this instanceof Failure<T> failure) {
            action.accept(failure.error());
        }
        return this;
    }

    record Success<T>(T value) implements ParseResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public <R> R fold(Function<StubError, R> onFailure, Function<T, R> onSuccess) {
            return onSuccess.apply(value);
        }
    }

    record Failure<T>(StubError error) implements ParseResult<T> {
        public Failure {
            if (error == null) {
                throw new IllegalArgumentException("Failure without error");
            }
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T unwrap() {
            throw new IllegalStateException("Parse failed: " + error.message());
        }

        @Override
        public <R> R fold(Function<StubError, R> onFailure, Function<T, R> onSuccess) {
            return onFailure.apply(error);
        }
    }
}
