package com.sheroshayari.auth.security;

/**
 * Reasons a bearer token is rejected.
 */
public enum TokenError {
    MALFORMED,
    INVALID_SIGNATURE,
    EXPIRED,
    INVALID_ISSUER,
    INVALID_AUDIENCE
}
