package com.govagent.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * AuthServiceApplication - Main entry point for the GovAgent Authentication Service.
 * 
 * This service owns the credential lifecycle of the GovAgent platform:
 * - Account registration with a salted, one-way password verifier
 * - Password login by email or login name
 * - Stateless session tokens (HMAC-SHA256 signed JWTs, 24 hour lifetime)
 * - Authenticated password rotation
 * 
 * Architecture Context:
 * - Connects to PostgreSQL for account persistence (schema managed by Flyway)
 * - Password hashing runs on a dedicated worker pool, off the servlet threads
 * - Stateless design - no server-side session store, tokens expire naturally
 * 
 * Startup fails if {@code auth.token.secret} is not configured; there is no
 * built-in fallback signing key.
 * 
 * API Base Path: /api/v1/auth
 * 
 * @see com.govagent.auth.controller.AuthController for REST endpoint definitions
 * @see com.govagent.auth.service.AccountService for the credential flows
 * @see com.govagent.auth.security.TokenService for JWT token operations
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class AuthServiceApplication {

    /**
     * Application entry point.
     * 
     * @param args Command-line arguments (supports standard Spring Boot args)
     */
    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
    }
}
