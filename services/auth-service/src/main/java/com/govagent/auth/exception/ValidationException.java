package com.govagent.auth.exception;

import java.util.Collections;
import java.util.Map;

/**
 * Missing or malformed input. The field map (field name to message) is returned
 * to the client as-is.
 */
public class ValidationException extends CredentialException {

    private final Map<String, String> fieldErrors;

    public ValidationException(String message) {
        this(message, Map.of());
    }

    public ValidationException(String message, Map<String, String> fieldErrors) {
        super(FailureKind.VALIDATION_ERROR, message);
        this.fieldErrors = Collections.unmodifiableMap(fieldErrors);
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
