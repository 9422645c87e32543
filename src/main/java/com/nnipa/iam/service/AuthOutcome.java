package com.nnipa.iam.service;

import com.nnipa.iam.exception.AuthErrorCode;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Result of an operation whose failures are expected outcomes: either a value or an {@link AuthErrorCode}.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class AuthOutcome<T> {

    private final T value;
    private final AuthErrorCode error;
    private final List<String> details;

    public static <T> AuthOutcome<T> success(T value) {
        return new AuthOutcome<>(value, null, List.of());
    }

    public static AuthOutcome<Void> success() {
        return new AuthOutcome<>(null, null, List.of());
    }

    public static <T> AuthOutcome<T> failure(AuthErrorCode error) {
        return failure(error, List.of());
    }

    public static <T> AuthOutcome<T> failure(AuthErrorCode error, List<String> details) {
        return new AuthOutcome<>(null, Objects.requireNonNull(error), List.copyOf(details));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public <R> AuthOutcome<R> map(Function<T, R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(error, details);
    }

    /**
     * Re-types a failure; must not be called on a success.
     */
    public <R> AuthOutcome<R> propagate() {
        if (isSuccess()) {
            throw new IllegalStateException("Cannot propagate a successful outcome");
        }
        return failure(error, details);
    }

    @Override
    public String toString() {
        return isSuccess() ? "AuthOutcome[success]" : "AuthOutcome[" + error + "]";
    }
}
