package com.govagent.auth.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.govagent.auth.dto.ApiError;
import com.govagent.auth.exception.FailureKind;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Writes {@link ApiError} bodies from the security filter chain, where the
 * controller advice does not reach.
 */
@Component
@RequiredArgsConstructor
public class ApiErrorWriter {

    private final ObjectMapper objectMapper;

    public void write(HttpServletResponse response, FailureKind kind, String message) throws IOException {
        response.setStatus(kind.getStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), ApiError.of(kind, message));
    }
}
