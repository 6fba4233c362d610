package com.sheroshayari.auth.security;

import lombok.Value;

import java.time.Instant;

/**
 * A freshly signed bearer token together with its validity window.
 */
@Value
public class IssuedToken {
    String token;
    Instant issuedAt;
    Instant expiresAt;
}
