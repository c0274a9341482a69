package com.govagent.auth.security;

import com.govagent.auth.exception.CryptoFailureException;
import com.govagent.auth.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("CredentialHasher")
class CredentialHasherTest {

    private static final Executor DIRECT = Runnable::run;

    private final CredentialHasher hasher = new CredentialHasher(new BCryptPasswordEncoder(4), DIRECT);

    @Nested
    @DisplayName("hash and verify")
    class HashAndVerify {

        @Test
        @DisplayName("a password verifies against its own verifier")
        void verifiesOwnHash() {
            String verifier = hasher.hash("correct horse").join();

            assertThat(hasher.verify("correct horse", verifier).join()).isTrue();
        }

        @Test
        @DisplayName("a different password does not verify")
        void rejectsOtherPassword() {
            String verifier = hasher.hash("correct horse").join();

            assertThat(hasher.verify("battery staple", verifier).join()).isFalse();
            assertThat(hasher.verify("Correct horse", verifier).join()).isFalse();
        }

        @Test
        @DisplayName("hashing twice gives different verifiers that both verify")
        void saltsEveryHash() {
            String first = hasher.hash("s3cret-pass").join();
            String second = hasher.hash("s3cret-pass").join();

            assertThat(first).isNotEqualTo(second);
            assertThat(hasher.verify("s3cret-pass", first).join()).isTrue();
            assertThat(hasher.verify("s3cret-pass", second).join()).isTrue();
        }

        @Test
        @DisplayName("the verifier never contains the plaintext")
        void verifierIsNotPlaintext() {
            String verifier = hasher.hash("s3cret-pass").join();

            assertThat(verifier).doesNotContain("s3cret-pass").startsWith("$2a$04$");
        }
    }

    @Nested
    @DisplayName("input limit")
    class InputLimit {

        @Test
        @DisplayName("a secret of exactly 72 bytes hashes and verifies")
        void acceptsLimit() {
            String secret = "a".repeat(72);
            String verifier = hasher.hash(secret).join();

            assertThat(hasher.verify(secret, verifier).join()).isTrue();
        }

        @Test
        @DisplayName("a longer secret sharing the first 72 bytes does not verify")
        void asciiSuffixDoesNotVerify() {
            String verifier = hasher.hash("a".repeat(72)).join();

            assertThat(hasher.verify("a".repeat(72) + "WRONG-SUFFIX", verifier).join()).isFalse();
        }

        @Test
        @DisplayName("limit is counted in UTF-8 bytes, not characters")
        void multiByteSecret() {
            String accepted = "é".repeat(36);
            String verifier = hasher.hash(accepted).join();

            assertThat(hasher.verify(accepted, verifier).join()).isTrue();
            assertThat(hasher.verify(accepted + "a", verifier).join()).isFalse();
            assertThat(CredentialHasher.exceedsLimit(accepted)).isFalse();
            assertThat(CredentialHasher.exceedsLimit(accepted + "a")).isTrue();
        }

        @Test
        @DisplayName("hashing a secret over 72 bytes fails with ValidationException")
        void hashRejectsOverLimit() {
            assertThatThrownBy(() -> hasher.hash("é".repeat(36) + "b").join())
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("malformed input")
    class MalformedInput {

        @Test
        @DisplayName("returns false for a verifier that is not BCrypt")
        void garbageVerifier() {
            assertThat(hasher.verify("s3cret-pass", "not-a-hash").join()).isFalse();
            assertThat(hasher.verify("s3cret-pass", "s3cret-pass").join()).isFalse();
        }

        @Test
        @DisplayName("returns false for null or blank input")
        void nullInput() {
            assertThat(hasher.verify(null, "$2a$04$abc").join()).isFalse();
            assertThat(hasher.verify("s3cret-pass", null).join()).isFalse();
            assertThat(hasher.verify("s3cret-pass", " ").join()).isFalse();
        }
    }

    @Nested
    @DisplayName("infrastructure failures")
    class InfrastructureFailures {

        @Test
        @DisplayName("a saturated pool completes with CryptoFailureException")
        void rejectedByPool() {
            Executor saturated = task -> {
                throw new RejectedExecutionException("queue full");
            };
            CredentialHasher busy = new CredentialHasher(new BCryptPasswordEncoder(4), saturated);

            assertThatThrownBy(() -> busy.hash("s3cret-pass").join())
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(CryptoFailureException.class);
        }

        @Test
        @DisplayName("an encoder failure completes with CryptoFailureException")
        void encoderFailure() {
            PasswordEncoder broken = mock(PasswordEncoder.class);
            when(broken.encode(anyString())).thenThrow(new IllegalStateException("no entropy"));
            CredentialHasher failing = new CredentialHasher(broken, DIRECT);

            assertThatThrownBy(() -> failing.hash("s3cret-pass").join())
                    .hasCauseInstanceOf(CryptoFailureException.class)
                    .hasRootCauseMessage("no entropy");
        }

        @Test
        @DisplayName("a wrong password never completes exceptionally")
        void wrongPasswordIsNotAFailure() {
            String verifier = hasher.hash("s3cret-pass").join();

            assertThat(hasher.verify("wrong", verifier)).isCompletedWithValue(false);
        }
    }
}
