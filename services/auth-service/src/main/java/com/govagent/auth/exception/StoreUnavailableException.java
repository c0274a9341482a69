package com.govagent.auth.exception;

/**
 * The account store failed for a reason other than a uniqueness violation.
 */
public class StoreUnavailableException extends CredentialException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(FailureKind.STORE_UNAVAILABLE, message, cause);
    }
}
