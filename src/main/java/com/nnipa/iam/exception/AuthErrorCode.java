package com.nnipa.iam.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Failure kinds reported to callers. Credential and code failures carry deliberately generic messages.
 */
@Getter
@RequiredArgsConstructor
public enum AuthErrorCode {

    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid email or password"),
    ACCOUNT_LOCKED(HttpStatus.LOCKED, "Account is temporarily locked"),
    EMAIL_NOT_CONFIRMED(HttpStatus.FORBIDDEN, "Email address has not been confirmed"),
    INVALID_TWO_FACTOR_REQUEST(HttpStatus.BAD_REQUEST, "Invalid two-factor verification request"),
    INVALID_OR_EXPIRED_CODE(HttpStatus.BAD_REQUEST, "Invalid or expired code"),
    INVALID_OR_EXPIRED_RESET_LINK(HttpStatus.BAD_REQUEST, "Invalid or expired password reset link"),
    INVALID_CURRENT_PASSWORD(HttpStatus.BAD_REQUEST, "Current password is incorrect"),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, "Authentication is required"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "Access denied"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "Resource not found"),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "Validation failed"),
    CONFLICT(HttpStatus.CONFLICT, "Resource already exists");

    private final HttpStatus status;
    private final String message;

    public String getCode() {
        return name();
    }
}
