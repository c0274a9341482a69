package com.govagent.auth.exception;

/**
 * Signature, structure or claims of a bearer token could not be trusted, or no
 * token was presented for a protected route.
 */
public class InvalidTokenException extends CredentialException {

    public InvalidTokenException(String message) {
        super(FailureKind.INVALID_TOKEN, message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(FailureKind.INVALID_TOKEN, message, cause);
    }
}
