package com.payguard.agent.error;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an operation that crosses a collaborator boundary.
 * Either carries a value or an {@link ErrorKind} with a message, never both.
 */
public record Result<T>(
        T value,
        ErrorKind error,
        String message
) {

    public static <T> Result<T> ok(T value) {
        return new Result<>(value, null, null);
    }

    public static Result<Void> ok() {
        return new Result<>(null, null, null);
    }

    public static <T> Result<T> failure(ErrorKind kind, String message) {
        Objects.requireNonNull(kind, "Error kind cannot be null");
        return new Result<>(null, kind, message != null ? message : kind.name());
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * Maps the value of a successful result, passing failures through unchanged.
     */
    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (isFailure()) {
            return Result.failure(error, message);
        }
        return Result.ok(mapper.apply(value));
    }

    /**
     * Re-types a failure so it can be returned from a method with another value type.
     */
    public <U> Result<U> asFailure() {
        if (isOk()) {
            throw new IllegalStateException("Result is not a failure");
        }
        return Result.failure(error, message);
    }
}
