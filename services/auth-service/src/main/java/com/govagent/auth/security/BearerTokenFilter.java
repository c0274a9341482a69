package com.govagent.auth.security;

import com.govagent.auth.exception.ExpiredTokenException;
import com.govagent.auth.exception.InvalidTokenException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * BearerTokenFilter - Authorization gate for protected endpoints.
 * 
 * HOW IT WORKS:
 * 1. Client sends "Authorization: Bearer &lt;token&gt;"
 * 2. The token is verified by {@link TokenService} (signature, issuer, expiry)
 * 3. On success an {@link AuthenticatedAccount} becomes the request principal
 * 4. On failure the request ends here with 401 and an ApiError body
 * 
 * Requests without a bearer token pass through unauthenticated; the security
 * chain then decides whether the route needs one. Public routes are skipped
 * entirely so a stale token never blocks login or registration.
 * 
 * Only the first few characters of a rejected token are logged.
 */
@Slf4j
public class BearerTokenFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final int LOGGED_TOKEN_CHARS = 12;

    private final TokenService tokenService;
    private final ApiErrorWriter errorWriter;
    private final RequestMatcher publicRoutes;

    public BearerTokenFilter(TokenService tokenService, ApiErrorWriter errorWriter, RequestMatcher publicRoutes) {
        this.tokenService = tokenService;
        this.errorWriter = errorWriter;
        this.publicRoutes = publicRoutes;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return publicRoutes.matches(request);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        Optional<String> token = extract(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token.isEmpty()) {
            chain.doFilter(request, response);
            return;
        }

        AuthenticatedAccount account;
        try {
            account = tokenService.verify(token.get());
        } catch (InvalidTokenException | ExpiredTokenException e) {
            log.warn("Bearer token rejected on {} {}: {} (token {}...)",
                    request.getMethod(), request.getRequestURI(), e.getKind(), abbreviate(token.get()));
            SecurityContextHolder.clearContext();
            errorWriter.write(response, e.getKind(), e.getMessage());
            return;
        }

        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(new UsernamePasswordAuthenticationToken(account, null, List.of()));
        SecurityContextHolder.setContext(context);
        chain.doFilter(request, response);
    }

    /**
     * Pull the token out of an Authorization header value.
     * 
     * @return the token, or empty for a missing header, another scheme or a blank token
     */
    static Optional<String> extract(String header) {
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Optional.empty();
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    private static String abbreviate(String token) {
        return token.substring(0, Math.min(LOGGED_TOKEN_CHARS, token.length()));
    }
}
