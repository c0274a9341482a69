package com.govagent.auth.security;

import com.govagent.auth.exception.FailureKind;
import jakarta.servlet.DispatcherType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.OrRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;

/**
 * Security configuration for the auth service.
 *
 * - Stateless: no HTTP session, identity comes from the bearer token on every request
 * - Public: register, login and the error page
 * - Everything else requires a verified token (fail-closed)
 */
@Configuration
public class SecurityConfig {

    private static final RequestMatcher PUBLIC_ROUTES = new OrRequestMatcher(
            new AntPathRequestMatcher("/api/v1/auth/register", HttpMethod.POST.name()),
            new AntPathRequestMatcher("/api/v1/auth/login", HttpMethod.POST.name()),
            new AntPathRequestMatcher("/error"));

    @Bean
    SecurityFilterChain apiChain(HttpSecurity http, TokenService tokenService, ApiErrorWriter errorWriter)
            throws Exception {
        return http
                .csrf(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .logout(AbstractHttpConfigurer::disable)
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        // async results of an already authorised request are dispatched again
                        .dispatcherTypeMatchers(DispatcherType.ASYNC, DispatcherType.ERROR).permitAll()
                        .requestMatchers(PUBLIC_ROUTES).permitAll()
                        .anyRequest().authenticated()
                )
                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint((request, response, e) -> errorWriter.write(
                                response, FailureKind.INVALID_TOKEN, "Not authorized to access this route"))
                )
                .addFilterBefore(new BearerTokenFilter(tokenService, errorWriter, PUBLIC_ROUTES),
                        UsernamePasswordAuthenticationFilter.class)
                .build();
    }
}
