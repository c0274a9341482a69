package com.govagent.auth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * AuthResponse - Successful outcome of a credential flow.
 * 
 * Registration and login carry a token, its expiry and the account projection.
 * Password change carries only the message, since existing tokens stay valid.
 * 
 * Example Response (login):
 * <pre>
 * {
 *   "success": true,
 *   "message": "Login successful!",
 *   "token": "eyJhbGciOiJIUzI1NiJ9...",
 *   "tokenType": "Bearer",
 *   "expiresAt": "2026-10-18T09:12:44Z",
 *   "account": { "id": "...", "loginName": "asha.k", ... }
 * }
 * </pre>
 * 
 * @see ApiError for the failure shape
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthResponse {

    /** Always true; failures use {@link ApiError}. */
    private boolean success;

    /**
     * Human-readable outcome (e.g., "Login successful!").
     */
    private String message;

    /**
     * Signed session token (HS256 JWT).
     * 
     * Send it back as {@code Authorization: Bearer <token>} on protected
     * routes. Absent after a password change.
     */
    private String token;

    /** Always "Bearer" when a token is present. */
    private String tokenType;

    /**
     * Expiry of {@link #token}, 24 hours after issue by default.
     * 
     * Format: ISO 8601 instant (e.g., "2026-10-18T09:12:44Z")
     */
    private Instant expiresAt;

    /** Sanitised account the token was issued for. */
    private AccountResponse account;
}
