package com.govagent.auth.exception;

/**
 * Base class for every failure a credential flow reports to its caller.
 * 
 * The message is user-facing and must never contain a password or a stored
 * verifier. Infrastructure failures keep their root cause for logging.
 */
public abstract class CredentialException extends RuntimeException {

    private final FailureKind kind;

    protected CredentialException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected CredentialException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
