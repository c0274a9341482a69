package com.govagent.auth.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure categories reported by the credential flows.
 * 
 * Each kind carries the HTTP status the REST layer answers with. Internal kinds
 * are logged with their detail and reported to clients as {@link #INTERNAL_ERROR}.
 */
public enum FailureKind {

    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, false),
    DUPLICATE_ACCOUNT(HttpStatus.BAD_REQUEST, false),
    ACCOUNT_NOT_FOUND(HttpStatus.NOT_FOUND, false),
    INVALID_CREDENTIALS(HttpStatus.BAD_REQUEST, false),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, false),
    EXPIRED_TOKEN(HttpStatus.UNAUTHORIZED, false),
    CRYPTO_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, true),
    STORE_UNAVAILABLE(HttpStatus.INTERNAL_SERVER_ERROR, true),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, true);

    private final HttpStatus status;
    private final boolean internal;

    FailureKind(HttpStatus status, boolean internal) {
        this.status = status;
        this.internal = internal;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public boolean isInternal() {
        return internal;
    }
}
