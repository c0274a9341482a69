package com.govagent.auth.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

/**
 * CredentialConfig - Beans backing password hashing and token timing.
 * 
 * BCrypt is deliberately slow, so hashing gets its own bounded pool instead of
 * running on servlet threads. When the pool and its queue are full, new hash
 * tasks are rejected and the flow reports a crypto failure.
 */
@Slf4j
@Configuration
public class CredentialConfig {

    public static final String HASH_EXECUTOR = "credentialHashExecutor";

    @Bean
    public PasswordEncoder passwordEncoder(HashingProperties properties) {
        log.info("BCrypt password encoder configured with strength {}", properties.getStrength());
        return new BCryptPasswordEncoder(properties.getStrength());
    }

    @Bean(name = HASH_EXECUTOR)
    public ThreadPoolTaskExecutor credentialHashExecutor(HashingProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getPoolSize());
        executor.setMaxPoolSize(properties.getPoolSize());
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("credential-hash-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
