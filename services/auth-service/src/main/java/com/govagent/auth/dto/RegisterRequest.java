package com.govagent.auth.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDate;

/**
 * RegisterRequest - Payload for creating a new account.
 * 
 * Every field is required. Email and login name are normalised (trimmed, email
 * lower-cased) by the service before uniqueness checks.
 * 
 * Usage:
 * <pre>
 * POST /api/v1/auth/register
 * Content-Type: application/json
 * 
 * {
 *   "loginName": "asha.k",
 *   "email": "Asha@Example.com",
 *   "password": "s3cret-pass",
 *   "phoneNumber": "+919876543210",
 *   "dateOfBirth": "1994-03-21",
 *   "gender": "female",
 *   "address": "12 MG Road, Pune"
 * }
 * </pre>
 * 
 * Security Note: the password is never logged; {@code toString()} excludes it.
 * 
 * @see com.govagent.auth.service.AccountService#register
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRequest {

    /** Must not contain "@", which is how login tells emails apart from login names. */
    @NotBlank
    @Size(min = 3, max = 50)
    @Pattern(regexp = "^[^@\\s]+$", message = "must not contain '@' or whitespace")
    private String loginName;

    @NotBlank
    @Email
    @Size(max = 255)
    private String email;

    /**
     * 6 to 72 characters. BCrypt reads at most 72 bytes, so the service also
     * rejects passwords whose UTF-8 encoding is longer than that.
     */
    @ToString.Exclude
    @NotBlank
    @Size(min = 6, max = 72)
    private String password;

    @NotBlank
    @Pattern(regexp = "^\\+?[0-9]{7,15}$", message = "must be 7 to 15 digits, optionally prefixed with +")
    private String phoneNumber;

    @NotNull
    @Past
    private LocalDate dateOfBirth;

    @NotBlank
    @Size(max = 30)
    private String gender;

    @NotBlank
    @Size(max = 500)
    private String address;
}
