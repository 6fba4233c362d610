package com.sheroshayari.auth.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * RegisterRequest - Body of POST /api/auth/register.
 *
 * Password length and the password/confirmPassword match are checked by the
 * service so they produce their dedicated error messages.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRequest {

    @NotBlank
    @Email
    @Size(max = 256)
    private String email;

    @NotBlank
    private String password;

    @NotBlank
    private String confirmPassword;

    /**
     * Optional display name; the email is used when omitted.
     */
    @Size(max = 256)
    private String fullName;
}
