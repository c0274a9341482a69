package com.govagent.auth.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for password hashing, bound from {@code auth.hashing.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "auth.hashing")
public class HashingProperties {

    /** BCrypt log2 work factor. 10 matches the cost accounts were originally hashed with. */
    @Min(4)
    @Max(31)
    private int strength = 10;

    /** Worker threads dedicated to hash and verify calls. */
    @Min(1)
    private int poolSize = Math.max(2, Runtime.getRuntime().availableProcessors());

    /** Pending hash tasks allowed before new ones are rejected. */
    @Min(0)
    private int queueCapacity = 500;
}
