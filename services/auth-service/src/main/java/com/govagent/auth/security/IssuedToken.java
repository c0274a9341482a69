package com.govagent.auth.security;

import lombok.Value;

import java.time.Instant;

/**
 * A freshly signed session token and the instant it stops being accepted.
 */
@Value
public class IssuedToken {
    String token;
    Instant expiresAt;
}
