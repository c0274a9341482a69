package com.govagent.auth.security;

import com.govagent.auth.exception.ExpiredTokenException;
import com.govagent.auth.exception.InvalidTokenException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * TokenService - Issues and verifies signed session tokens (JWT, RFC 7519).
 * 
 * Token Structure:
 * - Header: HS256, JWT
 * - Payload: sub (account id), name (login name), email, iss, iat, exp, jti
 * - Signature: HMAC-SHA256 with the process-wide secret
 * 
 * Configuration (application.yml):
 * - auth.token.secret: REQUIRED signing secret, at least 32 bytes. There is no
 *   default; a missing or short secret fails startup.
 * - auth.token.ttl: token lifetime, default 24 hours
 * - auth.token.issuer: issuer claim written and required on verification
 * 
 * Verification is stateless: nothing is stored server-side and nothing can be
 * revoked. Expiry is the only way a token stops working, and rotating the
 * secret invalidates every outstanding token at once. Changing an account's
 * password does not invalidate tokens already issued for it.
 * 
 * @see CredentialHasher for the password side of authentication
 */
@Slf4j
@Component
public class TokenService {

    static final String CLAIM_NAME = "name";
    static final String CLAIM_EMAIL = "email";

    private static final int MIN_SECRET_BYTES = 32;

    private final Key signingKey;
    private final Duration ttl;
    private final String issuer;
    private final Clock clock;
    private final JwtParser parser;

    public TokenService(@Value("${auth.token.secret}") String secret,
                        @Value("${auth.token.ttl:PT24H}") Duration ttl,
                        @Value("${auth.token.issuer:govagent-auth}") String issuer,
                        Clock clock) {
        this.signingKey = signingKey(secret);
        this.ttl = ttl;
        this.issuer = issuer;
        this.clock = clock;
        this.parser = Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .requireIssuer(issuer)
                .setClock(() -> Date.from(clock.instant()))
                .build();
        log.info("Session tokens signed with HS256, issuer '{}', lifetime {}", issuer, ttl);
    }

    /**
     * Derive the HMAC key, refusing anything that would make tokens forgeable.
     */
    private static Key signingKey(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("auth.token.secret is not set; refusing to start without a signing key");
        }
        byte[] keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "auth.token.secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }
        return Keys.hmacShaKeyFor(keyBytes);
    }

    /**
     * Mint a token for an account.
     * 
     * @param accountId subject, the account identifier
     * @param loginName denormalised login name
     * @param email denormalised email
     * @return compact JWT (header.payload.signature) and its expiry
     */
    public IssuedToken issue(UUID accountId, String loginName, String email) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);
        String token = Jwts.builder()
                .setId(UUID.randomUUID().toString())
                .setSubject(accountId.toString())
                .claim(CLAIM_NAME, loginName)
                .claim(CLAIM_EMAIL, email)
                .setIssuer(issuer)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(expiresAt))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
        return new IssuedToken(token, expiresAt);
    }

    /**
     * Check signature, issuer and expiry and return the asserted identity.
     * 
     * @param token compact JWT without the "Bearer " prefix
     * @return identity carried by the token
     * @throws ExpiredTokenException if the token is past its expiry
     * @throws InvalidTokenException for a bad signature, a foreign key, a
     *         malformed token or missing claims
     */
    public AuthenticatedAccount verify(String token) {
        Claims claims;
        try {
            claims = parser.parseClaimsJws(token).getBody();
        } catch (ExpiredJwtException e) {
            throw new ExpiredTokenException("Token expired, please login again", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid token", e);
        }

        String subject = claims.getSubject();
        if (subject == null) {
            throw new InvalidTokenException("Invalid token");
        }
        try {
            return new AuthenticatedAccount(
                    UUID.fromString(subject),
                    claims.get(CLAIM_NAME, String.class),
                    claims.get(CLAIM_EMAIL, String.class));
        } catch (IllegalArgumentException | JwtException e) {
            throw new InvalidTokenException("Invalid token", e);
        }
    }
}
