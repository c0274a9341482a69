package com.govagent.auth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.govagent.auth.exception.FailureKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * ApiError - Failure outcome of a credential flow or of the token gate.
 * 
 * <pre>
 * {
 *   "success": false,
 *   "kind": "VALIDATION_ERROR",
 *   "message": "Please fill all required fields.",
 *   "fields": { "email": "must not be blank" },
 *   "timestamp": "2026-10-17T09:12:44Z"
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

    private boolean success;
    private FailureKind kind;
    private String message;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, String> fields;
    private Instant timestamp;

    public static ApiError of(FailureKind kind, String message) {
        return of(kind, message, Map.of());
    }

    public static ApiError of(FailureKind kind, String message, Map<String, String> fields) {
        return ApiError.builder()
                .success(false)
                .kind(kind)
                .message(message)
                .fields(fields)
                .timestamp(Instant.now())
                .build();
    }
}
