package com.sheroshayari.auth.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of an auth workflow operation: a value and a success message, or an
 * {@link AuthError} and the message to show the caller.
 *
 * Expected failures (bad password, duplicate email, stale token) travel as
 * values of this type; exceptions are reserved for infrastructure faults.
 *
 * @param <T> type of the success value, {@link Void} when there is none
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AuthOutcome<T> {

    private final T value;
    private final AuthError error;
    private final String message;

    public static <T> AuthOutcome<T> success(T value, String message) {
        return new AuthOutcome<>(value, null, message);
    }

    public static <T> AuthOutcome<T> success(String message) {
        return new AuthOutcome<>(null, null, message);
    }

    public static <T> AuthOutcome<T> failure(AuthError error) {
        return new AuthOutcome<>(null, error, error.defaultMessage());
    }

    public static <T> AuthOutcome<T> failure(AuthError error, String message) {
        return new AuthOutcome<>(null, error, message);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
