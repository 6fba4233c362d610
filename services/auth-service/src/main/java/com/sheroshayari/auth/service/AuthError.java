package com.sheroshayari.auth.service;

import org.springframework.http.HttpStatus;

/**
 * Failure kinds of the auth workflow, with the HTTP status and the
 * client-facing message each one maps to.
 *
 * INVALID_CREDENTIALS and INVALID_OR_EXPIRED_TOKEN messages are generic:
 * they never reveal whether the email exists.
 */
public enum AuthError {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "Invalid request."),
    PASSWORD_MISMATCH(HttpStatus.BAD_REQUEST, "Passwords do not match."),
    DUPLICATE_EMAIL(HttpStatus.BAD_REQUEST, "Registration failed: an account with this email already exists."),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid email or password."),
    EMAIL_NOT_CONFIRMED(HttpStatus.BAD_REQUEST, "Please confirm your email before logging in."),
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "User not found."),
    INVALID_TOKEN(HttpStatus.BAD_REQUEST, "Email confirmation failed."),
    INVALID_EMAIL(HttpStatus.BAD_REQUEST, "Invalid email address."),
    INVALID_OR_EXPIRED_TOKEN(HttpStatus.BAD_REQUEST,
            "Password reset link is invalid or has expired. Please request a new one."),
    EMAIL_SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE,
            "Email service is currently unavailable. Please try again in a few minutes."),
    UNEXPECTED(HttpStatus.INTERNAL_SERVER_ERROR, "An error occurred. Please try again later.");

    private final HttpStatus status;
    private final String defaultMessage;

    AuthError(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
