package com.govagent.auth.service;

import com.govagent.auth.dto.RegisterRequest;
import com.govagent.auth.exception.DuplicateAccountException;
import com.govagent.auth.repository.AccountRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Registrations racing on one email against the real store: the unique index
 * must let exactly one through.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Concurrent registration")
class ConcurrentRegistrationTest {

    private static final int CALLERS = 8;

    @Autowired
    private AccountService accountService;

    @Autowired
    private AccountRepository accountRepository;

    private ExecutorService callers;

    @BeforeEach
    void setUp() {
        accountRepository.deleteAll();
        callers = Executors.newFixedThreadPool(CALLERS);
    }

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
    }

    private static RegisterRequest registration(int caller) {
        return RegisterRequest.builder()
                .loginName("racer" + caller)
                .email("race@example.com")
                .password("s3cret-pass")
                .phoneNumber("9876543210")
                .dateOfBirth(LocalDate.of(1990, 1, 1))
                .gender("male")
                .address("1 Race Street")
                .build();
    }

    @Test
    @DisplayName("exactly one of many simultaneous registrations with the same email succeeds")
    void exactlyOneWins() throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Throwable>> outcomes = new ArrayList<>();
        for (int i = 0; i < CALLERS; i++) {
            int caller = i;
            outcomes.add(callers.submit(() -> {
                start.await();
                try {
                    accountService.register(registration(caller)).join();
                    return null;
                } catch (CompletionException e) {
                    return e.getCause();
                }
            }));
        }
        start.countDown();

        int successes = 0;
        List<Throwable> failures = new ArrayList<>();
        for (Future<Throwable> outcome : outcomes) {
            Throwable failure = outcome.get(30, TimeUnit.SECONDS);
            if (failure == null) {
                successes++;
            } else {
                failures.add(failure);
            }
        }

        assertThat(successes).isEqualTo(1);
        assertThat(failures).hasSize(CALLERS - 1).allMatch(DuplicateAccountException.class::isInstance);
        assertThat(accountRepository.count()).isEqualTo(1);
        assertThat(accountRepository.findByEmail("race@example.com")).isPresent();
    }
}
