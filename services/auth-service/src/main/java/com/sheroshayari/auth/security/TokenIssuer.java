package com.sheroshayari.auth.security;

import java.time.Duration;

/**
 * Mints and validates signed, time-bounded bearer tokens.
 */
public interface TokenIssuer {

    /**
     * @throws IllegalArgumentException if {@code ttl} is zero or negative
     */
    IssuedToken issue(String userId, String email, String displayName, Duration ttl);

    /**
     * Verify signature, issuer, audience and expiry. Never throws.
     */
    TokenValidation validate(String token);
}
