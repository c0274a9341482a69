package com.govagent.auth.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Account - JPA Entity representing a registered identity.
 * 
 * Maps to the 'accounts' table (V1__create_accounts.sql). This is the only
 * persisted entity of the auth service; session tokens are never stored.
 * 
 * Table Schema:
 * - id: UUID primary key, assigned on first persist, immutable
 * - login_name: unique login/display name
 * - email: unique, stored trimmed and lower-cased
 * - password_hash: BCrypt verifier, never the plaintext
 * - phone_number, date_of_birth, gender, address: profile set at registration
 * - created_at / updated_at: maintained by Hibernate, never by application code
 * 
 * Uniqueness of email and login_name is enforced by unique indexes, which is what
 * makes concurrent registrations with the same email safe.
 * 
 * The password hash must never leave the service: responses are built from
 * {@link com.govagent.auth.dto.AccountResponse}, and {@code toString()} excludes it.
 * 
 * @see com.govagent.auth.repository.AccountRepository for database operations
 */
@Entity
@Table(name = "accounts")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Account {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "login_name", unique = true, nullable = false, length = 50)
    private String loginName;

    /** Always lower-case; lookups must normalise first. */
    @Column(name = "email", unique = true, nullable = false)
    private String email;

    /**
     * Salted one-way verifier produced by
     * {@link com.govagent.auth.security.CredentialHasher}.
     * Written only by registration and password change.
     */
    @ToString.Exclude
    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    @Column(name = "phone_number", nullable = false, length = 20)
    private String phoneNumber;

    @Column(name = "date_of_birth", nullable = false)
    private LocalDate dateOfBirth;

    @Column(name = "gender", nullable = false, length = 30)
    private String gender;

    @Column(name = "address", nullable = false, length = 500)
    private String address;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * JPA lifecycle callback executed before INSERT.
     * The store assigns the identifier; callers never supply one.
     */
    @PrePersist
    public void prePersist() {
        if (id == null) {
            id = UUID.randomUUID();
        }
    }
}
