package com.sheroshayari.auth.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ForgotPasswordRequest - Body of POST /api/auth/forgot-password.
 *
 * Example Request:
 * <pre>
 * {
 *   "email": "a@x.com"
 * }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ForgotPasswordRequest {

    @NotBlank(message = "Email is required.")
    private String email;
}
