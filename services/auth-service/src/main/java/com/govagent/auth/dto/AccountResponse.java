package com.govagent.auth.dto;

import com.govagent.auth.entity.Account;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * AccountResponse - Sanitised projection of an {@link Account}.
 * 
 * This is the only shape in which account data leaves the service. It has no
 * password field, so the stored verifier cannot leak through a response.
 * 
 * Example Response:
 * <pre>
 * {
 *   "id": "123e4567-e89b-12d3-a456-426614174000",
 *   "loginName": "asha.k",
 *   "email": "asha@example.com",
 *   "phoneNumber": "+919876543210",
 *   "dateOfBirth": "1994-03-21",
 *   "gender": "female",
 *   "address": "12 MG Road, Pune",
 *   "createdAt": "2026-10-17T09:12:44"
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountResponse {

    /**
     * Account identifier, also the {@code sub} claim of every token issued for it.
     */
    private UUID id;

    /** Unique, case-sensitive handle usable instead of the email at login. */
    private String loginName;

    /**
     * Unique email address, stored trimmed and lower-cased.
     */
    private String email;

    /** 7 to 15 digits, optionally prefixed with +. */
    private String phoneNumber;

    /** Format: ISO 8601 date (e.g., "1994-03-21"). */
    private LocalDate dateOfBirth;

    /** Free text as entered at registration. */
    private String gender;

    /** Postal address, free text. */
    private String address;

    /**
     * When the account was registered.
     */
    private LocalDateTime createdAt;

    /** Last profile or password change. */
    private LocalDateTime updatedAt;

    /**
     * Project an entity, leaving out the password verifier.
     */
    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
                .id(account.getId())
                .loginName(account.getLoginName())
                .email(account.getEmail())
                .phoneNumber(account.getPhoneNumber())
                .dateOfBirth(account.getDateOfBirth())
                .gender(account.getGender())
                .address(account.getAddress())
                .createdAt(account.getCreatedAt())
                .updatedAt(account.getUpdatedAt())
                .build();
    }
}
