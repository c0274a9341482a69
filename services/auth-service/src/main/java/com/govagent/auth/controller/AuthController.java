package com.govagent.auth.controller;

import com.govagent.auth.dto.AccountResponse;
import com.govagent.auth.dto.AuthResponse;
import com.govagent.auth.dto.ChangePasswordRequest;
import com.govagent.auth.dto.LoginRequest;
import com.govagent.auth.dto.RegisterRequest;
import com.govagent.auth.service.AccountService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * AuthController - REST API endpoints for the credential lifecycle.
 * 
 * Endpoints:
 * - POST /api/v1/auth/register         - Create an account, returns a session token
 * - POST /api/v1/auth/login            - Authenticate, returns a session token
 * - POST /api/v1/auth/change-password  - Rotate own password (requires auth)
 * - GET  /api/v1/auth/me               - Current account profile (requires auth)
 * 
 * Security Model:
 * - Stateless authentication using JWT tokens (24 hour lifetime)
 * - Protected endpoints take the account from the verified token, never from
 *   the request body
 * 
 * The password endpoints return {@link CompletableFuture}s: BCrypt work runs on
 * the hashing pool and the servlet thread is released while it does.
 * 
 * Error Handling (see GlobalExceptionHandler):
 * - 400 Bad Request: validation errors, duplicate account, invalid credentials
 * - 401 Unauthorized: missing, invalid or expired token
 * - 404 Not Found: account no longer exists
 * - 500 Internal Server Error: store or crypto failures
 * 
 * @see AccountService for business logic
 */
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AccountService accountService;

    /**
     * Register a new account.
     * 
     * @param request registration payload
     * @return 201 Created with token and sanitised account
     */
    @PostMapping("/register")
    public CompletableFuture<ResponseEntity<AuthResponse>> register(@RequestBody RegisterRequest request) {
        return accountService.register(request)
                .thenApply(response -> ResponseEntity.status(HttpStatus.CREATED).body(response));
    }

    /**
     * Authenticate with email or login name and password.
     * 
     * @param request login payload
     * @return 200 OK with token and sanitised account
     */
    @PostMapping("/login")
    public CompletableFuture<ResponseEntity<AuthResponse>> login(@RequestBody LoginRequest request) {
        return accountService.login(request).thenApply(ResponseEntity::ok);
    }

    /**
     * Change the password of the authenticated account.
     * 
     * The Principal is populated by the bearer token filter; its name is the
     * account id from the token subject.
     * 
     * @param principal verified token identity
     * @param request old and new password
     * @return 200 OK; no new token is issued
     */
    @PostMapping("/change-password")
    public CompletableFuture<ResponseEntity<AuthResponse>> changePassword(
            Principal principal,
            @RequestBody ChangePasswordRequest request) {
        UUID accountId = UUID.fromString(principal.getName());
        return accountService.changePassword(accountId, request).thenApply(ResponseEntity::ok);
    }

    /**
     * Get the profile of the authenticated account.
     * 
     * @param principal verified token identity
     * @return 200 OK with the sanitised account
     */
    @GetMapping("/me")
    public ResponseEntity<AccountResponse> me(Principal principal) {
        UUID accountId = UUID.fromString(principal.getName());
        return ResponseEntity.ok(accountService.getProfile(accountId));
    }
}
