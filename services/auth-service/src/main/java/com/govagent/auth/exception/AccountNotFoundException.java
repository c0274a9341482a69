package com.govagent.auth.exception;

/**
 * No account exists for the token subject, or for a login identifier when
 * unknown accounts are revealed. Maps to 404.
 */
public class AccountNotFoundException extends CredentialException {

    public AccountNotFoundException(String message) {
        super(FailureKind.ACCOUNT_NOT_FOUND, message);
    }
}
