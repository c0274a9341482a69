package com.govagent.auth.exception;

import com.govagent.auth.dto.ApiError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("returns client-fixable failures with their kind and message")
    void clientFailure() {
        ResponseEntity<ApiError> response = handler.handleCredential(
                new ValidationException("Please fill all required fields.", Map.of("email", "must not be blank")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().isSuccess()).isFalse();
        assertThat(response.getBody().getKind()).isEqualTo(FailureKind.VALIDATION_ERROR);
        assertThat(response.getBody().getFields()).containsEntry("email", "must not be blank");
    }

    @Test
    @DisplayName("maps each kind to its status")
    void statuses() {
        assertThat(handler.handleCredential(new DuplicateAccountException("taken")).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(handler.handleCredential(new AccountNotFoundException("gone")).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(handler.handleCredential(new InvalidCredentialsException("no")).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(handler.handleCredential(new ExpiredTokenException("late")).getStatusCode())
                .isEqualTo(HttpStatus.UNAUTHORIZED);
    }

    @Test
    @DisplayName("hides infrastructure detail behind a generic internal error")
    void internalFailure() {
        ResponseEntity<ApiError> response = handler.handleCredential(new StoreUnavailableException(
                "Account store unavailable", new DataAccessResourceFailureException("jdbc:postgresql://db:5432")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getKind()).isEqualTo(FailureKind.INTERNAL_ERROR);
        assertThat(response.getBody().getMessage()).isEqualTo(GlobalExceptionHandler.GENERIC_MESSAGE);
    }

    @Test
    @DisplayName("treats unknown exceptions as internal errors")
    void unexpected() {
        ResponseEntity<ApiError> response = handler.handleUnexpected(new IllegalStateException("boom"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getMessage()).doesNotContain("boom");
    }
}
