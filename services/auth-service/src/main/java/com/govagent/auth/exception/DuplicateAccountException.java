package com.govagent.auth.exception;

/**
 * Registration hit an email or login name that is already taken, either on the
 * advisory lookup or on the unique index at insert time.
 */
public class DuplicateAccountException extends CredentialException {

    public DuplicateAccountException(String message) {
        super(FailureKind.DUPLICATE_ACCOUNT, message);
    }

    public DuplicateAccountException(String message, Throwable cause) {
        super(FailureKind.DUPLICATE_ACCOUNT, message, cause);
    }
}
