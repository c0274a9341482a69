package com.govagent.auth.exception;

/**
 * A bearer token with a valid signature whose expiry has passed. The client
 * should log in again.
 */
public class ExpiredTokenException extends CredentialException {

    public ExpiredTokenException(String message) {
        super(FailureKind.EXPIRED_TOKEN, message);
    }

    public ExpiredTokenException(String message, Throwable cause) {
        super(FailureKind.EXPIRED_TOKEN, message, cause);
    }
}
