package com.feeledger.error;

import java.util.function.Function;

/**
 * Outcome of a public operation: either a value or a typed error.
 * Domain failures never cross the API boundary as exceptions.
 */
public sealed interface Result<T> {

    record Ok<T>(T value) implements Result<T> {}

    record Err<T>(ErrorCode errorCode, String errorMessage) implements Result<T> {}

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(ErrorCode code, String message) {
        return new Err<>(code, message);
    }

    default boolean isSuccess() {
        return this instanceof Ok<T>;
    }

    /** Returns the value, or throws {@link IllegalStateException} for an error result. */
    default T orElseThrow() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        Err<T> err = (Err<T>) this;
        throw new IllegalStateException(err.errorCode() + ": " + err.errorMessage());
    }

    /** The error code, or null for a successful result. */
    default ErrorCode errorCode() {
        return this instanceof Err<T> err ? err.errorCode() : null;
    }

    default <U> Result<U> map(Function<T, U> mapper) {
        if (this instanceof Ok<T> ok) {
            return new Ok<>(mapper.apply(ok.value()));
        }
        Err<T> err = (Err<T>) this;
        return new Err<>(err.errorCode(), err.errorMessage());
    }

    /** Re-types an error result; fails for a successful one. */
    default <U> Result<U> asError() {
        if (this instanceof Err<T> err) {
            return new Err<>(err.errorCode(), err.errorMessage());
        }
        throw new IllegalStateException("Result is not an error");
    }
}
