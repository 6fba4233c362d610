package com.sheroshayari.auth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * RegisterResponse - Body returned by POST /api/auth/register.
 *
 * Example Response:
 * <pre>
 * {
 *   "success": true,
 *   "message": "Registration successful. Please check your email to confirm your account.",
 *   "userId": "123e4567-e89b-12d3-a456-426614174000"
 * }
 * </pre>
 *
 * userId is only present on success.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RegisterResponse {
    private boolean success;
    private String message;
    private String userId;
}
