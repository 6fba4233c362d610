package com.sheroshayari.auth.security;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of {@link TokenIssuer#validate(String)}: either the verified claims or
 * the reason the token was rejected, never both.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TokenValidation {

    TokenClaims claims;
    TokenError error;

    public static TokenValidation valid(TokenClaims claims) {
        return new TokenValidation(claims, null);
    }

    public static TokenValidation invalid(TokenError error) {
        return new TokenValidation(null, error);
    }

    public boolean isValid() {
        return error == null;
    }
}
