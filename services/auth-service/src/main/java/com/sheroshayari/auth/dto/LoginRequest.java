package com.sheroshayari.auth.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * LoginRequest - Body of POST /api/auth/login.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    /**
     * Email address of the account.
     *
     * Only @NotBlank: a malformed address must fail the same way as an unknown
     * one, so format is not validated here.
     */
    @NotBlank
    private String email;

    /**
     * Plaintext password; checked against the stored BCrypt hash and never logged.
     */
    @NotBlank
    private String password;
}
