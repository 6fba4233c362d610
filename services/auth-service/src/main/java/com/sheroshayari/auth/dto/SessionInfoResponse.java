package com.sheroshayari.auth.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * SessionInfoResponse - Body returned by GET /api/auth/session.
 *
 * Lets the client check that its stored token is still accepted and when it
 * will have to log in again.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionInfoResponse {

    private String userId;

    private String email;

    private String fullName;

    /**
     * Whether the confirmation link sent at registration has been followed.
     */
    private boolean emailConfirmed;

    /**
     * Expiry of the bearer token used for this request.
     */
    private Instant expiresAt;
}
