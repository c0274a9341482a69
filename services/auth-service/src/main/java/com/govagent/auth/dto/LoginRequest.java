package com.govagent.auth.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * LoginRequest - Payload for password login.
 * 
 * The identifier is either an email address or a login name: a value
 * containing "@" is looked up as an email, anything else as a login name.
 * 
 * Usage:
 * <pre>
 * POST /api/v1/auth/login
 * Content-Type: application/json
 * 
 * {
 *   "identifier": "asha@example.com",
 *   "password": "s3cret-pass"
 * }
 * </pre>
 * 
 * Security Note:
 * Password should be transmitted over HTTPS only.
 * Never log or persist the password field.
 * 
 * @see com.govagent.auth.service.AccountService#login
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    /**
     * Email address or login name.
     */
    @NotBlank
    private String identifier;

    @ToString.Exclude
    @NotBlank
    private String password;
}
