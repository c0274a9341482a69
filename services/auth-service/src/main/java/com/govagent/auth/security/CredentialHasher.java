package com.govagent.auth.security;

import com.govagent.auth.config.CredentialConfig;
import com.govagent.auth.exception.CryptoFailureException;
import com.govagent.auth.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * CredentialHasher - One-way password hashing and verification.
 * 
 * Wraps a BCrypt {@link PasswordEncoder}:
 * - hash() embeds a fresh random salt in every verifier, so hashing the same
 *   password twice yields two different strings that both verify
 * - verify() re-derives with the embedded salt and compares in constant time
 * 
 * Both operations are CPU-bound (tunable work factor) and run on the dedicated
 * {@value CredentialConfig#HASH_EXECUTOR} pool. Callers get a
 * {@link CompletableFuture} and never block a request thread on BCrypt.
 * 
 * Input Limit:
 * BCrypt only reads the first {@value #MAX_SECRET_BYTES} bytes of its input,
 * so two secrets sharing that prefix would collide. hash() refuses longer
 * secrets (UTF-8 length) and verify() never matches them.
 * 
 * Failure Semantics:
 * - A wrong password, an over-long password or a malformed verifier
 *   completes verify() with false
 * - Only infrastructure problems (pool saturation, entropy source errors)
 *   complete the future exceptionally with {@link CryptoFailureException}
 * 
 * Plaintext passwords and verifiers are never logged.
 */
@Slf4j
@Component
public class CredentialHasher {

    public static final int MAX_SECRET_BYTES = 72;

    private final PasswordEncoder passwordEncoder;
    private final Executor executor;

    public CredentialHasher(PasswordEncoder passwordEncoder,
                            @Qualifier(CredentialConfig.HASH_EXECUTOR) Executor executor) {
        this.passwordEncoder = passwordEncoder;
        this.executor = executor;
    }

    /**
     * Produce a storable verifier for a plaintext password.
     * 
     * @param secret plaintext password, must not be null
     * @return future verifier (BCrypt modular crypt string, e.g. "$2a$10$..."),
     *         or a {@link ValidationException} if the secret is too long
     */
    public CompletableFuture<String> hash(String secret) {
        if (secret == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("secret must not be null"));
        }
        if (exceedsLimit(secret)) {
            return CompletableFuture.failedFuture(new ValidationException("Invalid request.",
                    Map.of("password", "must be at most " + MAX_SECRET_BYTES + " bytes")));
        }
        return submit("hash", () -> passwordEncoder.encode(secret));
    }

    /**
     * Check a plaintext password against a stored verifier.
     * 
     * @param secret plaintext password
     * @param verifier verifier previously produced by {@link #hash(String)}
     * @return future true on match; false on mismatch, null input or malformed verifier
     */
    public CompletableFuture<Boolean> verify(String secret, String verifier) {
        if (secret == null || verifier == null || verifier.isBlank() || exceedsLimit(secret)) {
            return CompletableFuture.completedFuture(false);
        }
        return submit("verify", () -> matches(secret, verifier));
    }

    /**
     * @return true if the UTF-8 encoding of {@code secret} is longer than BCrypt reads
     */
    public static boolean exceedsLimit(String secret) {
        return secret.getBytes(StandardCharsets.UTF_8).length > MAX_SECRET_BYTES;
    }

    private boolean matches(String secret, String verifier) {
        try {
            return passwordEncoder.matches(secret, verifier);
        } catch (IllegalArgumentException e) {
            // unparseable salt in an otherwise BCrypt-shaped verifier
            log.warn("Stored verifier could not be parsed: {}", e.getMessage());
            return false;
        }
    }

    private <T> CompletableFuture<T> submit(String operation, Supplier<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    result.complete(task.get());
                } catch (RuntimeException e) {
                    log.error("Credential {} failed", operation, e);
                    result.completeExceptionally(
                            new CryptoFailureException("Credential " + operation + " failed", e));
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Credential {} rejected, hashing pool saturated", operation);
            result.completeExceptionally(
                    new CryptoFailureException("Credential " + operation + " rejected", e));
        }
        return result;
    }
}
