package com.govagent.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * ChangePasswordRequest - Payload for rotating the caller's own password.
 * 
 * There is deliberately no email or account id field: the account is the
 * subject of the bearer token that authenticated the request.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChangePasswordRequest {

    @ToString.Exclude
    @NotBlank
    private String oldPassword;

    /** Same length rules as at registration, including the 72-byte cap. */
    @ToString.Exclude
    @NotBlank
    @Size(min = 6, max = 72)
    private String newPassword;
}
