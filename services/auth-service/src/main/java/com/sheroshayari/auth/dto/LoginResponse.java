package com.sheroshayari.auth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * LoginResponse - Body returned by POST /api/auth/login.
 *
 * Example Response:
 * <pre>
 * {
 *   "success": true,
 *   "message": "Login successful.",
 *   "accessToken": "eyJhbGciOiJIUzI1NiJ9...",
 *   "userId": "123e4567-e89b-12d3-a456-426614174000",
 *   "email": "a@x.com",
 *   "expiresAt": "2024-01-15T10:30:00Z"
 * }
 * </pre>
 *
 * On failure only success and message are present, and the message is the
 * same for an unknown email and a wrong password.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoginResponse {

    private boolean success;

    private String message;

    /**
     * Bearer token to send as "Authorization: Bearer &lt;token&gt;".
     */
    private String accessToken;

    private String userId;

    private String email;

    /**
     * When the access token stops validating (exp claim).
     */
    private Instant expiresAt;
}
