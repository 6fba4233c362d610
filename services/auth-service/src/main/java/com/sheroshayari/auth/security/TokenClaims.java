package com.sheroshayari.auth.security;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Typed view of the claims carried by a bearer token.
 *
 * <pre>
 * {
 *   "sub":   "3f1c...",              // user id
 *   "email": "a@x.com",
 *   "name":  "A",
 *   "iss":   "SheroShayariAPI",
 *   "aud":   "SheroShayariUsers",
 *   "iat":   1718000000,
 *   "exp":   1718003600
 * }
 * </pre>
 */
@Value
@Builder
public class TokenClaims {
    String subject;
    String email;
    String name;
    String issuer;
    String audience;
    Instant issuedAt;
    Instant expiresAt;
}
