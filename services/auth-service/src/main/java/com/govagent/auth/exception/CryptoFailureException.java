package com.govagent.auth.exception;

/**
 * Hashing or verification could not run: the worker pool rejected the task or
 * the underlying primitive failed. Never raised for a wrong password.
 */
public class CryptoFailureException extends CredentialException {

    public CryptoFailureException(String message, Throwable cause) {
        super(FailureKind.CRYPTO_FAILURE, message, cause);
    }
}
