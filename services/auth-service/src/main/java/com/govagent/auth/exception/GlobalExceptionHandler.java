package com.govagent.auth.exception;

import com.govagent.auth.dto.ApiError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps credential failures to {@link ApiError} responses.
 * 
 * Client-fixable kinds are returned with their own message. Internal kinds
 * (store, crypto, anything unexpected) are logged with the full cause and
 * returned as a generic INTERNAL_ERROR so no infrastructure detail leaks.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String GENERIC_MESSAGE = "An unexpected error occurred";

    @ExceptionHandler(CredentialException.class)
    public ResponseEntity<ApiError> handleCredential(CredentialException ex) {
        FailureKind kind = ex.getKind();
        if (kind.isInternal()) {
            log.error("{}: {}", kind, ex.getMessage(), ex.getCause() != null ? ex.getCause() : ex);
            return ResponseEntity.status(kind.getStatus())
                    .body(ApiError.of(FailureKind.INTERNAL_ERROR, GENERIC_MESSAGE));
        }

        log.warn("{}: {}", kind, ex.getMessage());
        Map<String, String> fields = ex instanceof ValidationException
                ? ((ValidationException) ex).getFieldErrors()
                : Map.of();
        return ResponseEntity.status(kind.getStatus()).body(ApiError.of(kind, ex.getMessage(), fields));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest()
                .body(ApiError.of(FailureKind.VALIDATION_ERROR, "Malformed request body."));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiError> handleMediaType(HttpMediaTypeNotSupportedException ex) {
        log.warn("Unsupported content type: {}", ex.getContentType());
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(ApiError.of(FailureKind.VALIDATION_ERROR, "Request body must be JSON."));
    }

    /**
     * Framework errors that already know their status (unknown route, wrong
     * method) keep it.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse && ((ErrorResponse) ex).getStatusCode().is4xxClientError()) {
            ErrorResponse error = (ErrorResponse) ex;
            log.warn("Request rejected: {}", ex.getMessage());
            return ResponseEntity.status(error.getStatusCode())
                    .body(ApiError.of(FailureKind.VALIDATION_ERROR, error.getBody().getDetail()));
        }
        log.error("Internal server error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiError.of(FailureKind.INTERNAL_ERROR, GENERIC_MESSAGE));
    }
}
