package com.govagent.auth.exception;

/**
 * Wrong password at login or password change. Also used for an unknown login
 * identifier, so the two cases look the same to the caller.
 */
public class InvalidCredentialsException extends CredentialException {

    public InvalidCredentialsException(String message) {
        super(FailureKind.INVALID_CREDENTIALS, message);
    }
}
