package com.govagent.auth.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BearerTokenFilter header parsing")
class BearerTokenFilterTest {

    @Test
    @DisplayName("extracts the token from a Bearer header")
    void extractsToken() {
        assertThat(BearerTokenFilter.extract("Bearer eyJhbGciOiJIUzI1NiJ9.payload.sig"))
                .contains("eyJhbGciOiJIUzI1NiJ9.payload.sig");
    }

    @Test
    @DisplayName("accepts any case for the scheme and trims the token")
    void caseInsensitiveScheme() {
        assertThat(BearerTokenFilter.extract("bearer   my-token ")).contains("my-token");
    }

    @Test
    @DisplayName("ignores missing, blank and non-Bearer headers")
    void ignoresOthers() {
        assertThat(BearerTokenFilter.extract(null)).isEmpty();
        assertThat(BearerTokenFilter.extract("")).isEmpty();
        assertThat(BearerTokenFilter.extract("Bearer ")).isEmpty();
        assertThat(BearerTokenFilter.extract("Basic dXNlcjpwYXNz")).isEmpty();
        assertThat(BearerTokenFilter.extract("Bearertoken")).isEmpty();
    }
}
