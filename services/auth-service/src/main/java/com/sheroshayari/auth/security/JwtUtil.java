package com.sheroshayari.auth.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.InvalidClaimException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SecurityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Date;

/**
 * JwtUtil - JSON Web Token operations for SheroShayari bearer tokens.
 *
 * JWT Structure (RFC 7519):
 * - Header: Algorithm (HS256) and token type (JWT)
 * - Payload: sub (user id), email, name, iss, aud, iat, exp
 * - Signature: HMAC-SHA256 using the server's secret key
 *
 * Configuration (from application.yml):
 * - jwt.secret: HMAC signing key (min 256 bits for HS256)
 * - jwt.issuer: value of the iss claim, checked on validation
 * - jwt.audience: value of the aud claim, checked on validation
 *
 * Validation is exact: no clock skew is tolerated, so a token is rejected as
 * soon as the clock passes its exp claim.
 *
 * Token Lifecycle:
 * 1. User logs in successfully
 * 2. issue() creates a signed JWT carrying the user's identity claims
 * 3. Frontend sends it as "Authorization: Bearer &lt;token&gt;"
 * 4. validate() verifies signature, issuer, audience and expiry on each request
 * 5. Logout does not revoke it; it stays valid until exp
 *
 * @see com.sheroshayari.auth.web.JwtAuthenticationFilter for request-side validation
 */
@Component
@Slf4j
public class JwtUtil implements TokenIssuer {

    static final String EMAIL_CLAIM = "email";
    static final String NAME_CLAIM = "name";

    private final SecretKey signingKey;
    private final String issuer;
    private final String audience;
    private final Clock clock;
    private final JwtParser parser;

    /**
     * @param secret HMAC secret; must be at least 32 bytes of UTF-8 for HS256
     * @param issuer expected and emitted iss claim
     * @param audience expected and emitted aud claim
     * @param clock source of the current time for iat, exp and expiry checks
     * @throws io.jsonwebtoken.security.WeakKeyException if the secret is too short
     */
    public JwtUtil(
            @Value("${jwt.secret}") String secret,
            @Value("${jwt.issuer:SheroShayariAPI}") String issuer,
            @Value("${jwt.audience:SheroShayariUsers}") String audience,
            Clock clock) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("jwt.secret is not configured. Set JWT_SECRET.");
        }
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.issuer = issuer;
        this.audience = audience;
        this.clock = clock;
        this.parser = Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .requireIssuer(issuer)
                .requireAudience(audience)
                .setAllowedClockSkewSeconds(0)
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    /**
     * Generate a signed JWT for an authenticated user.
     *
     * iat and exp are whole seconds (the JWT NumericDate resolution), so the
     * returned window is exactly what a validator will see.
     *
     * @param userId Subject claim
     * @param email Email claim
     * @param displayName Name claim
     * @param ttl Lifetime of the token, must be positive
     * @return Signed compact token plus its iat/exp
     *
     * Token Format Example:
     * eyJhbGciOiJIUzI1NiJ9.eyJzdWIiOiJ1c2VyLXV1aWQiLCJpYXQiOjE2...}.signature
     */
    @Override
    public IssuedToken issue(String userId, String email, String displayName, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Token ttl must be positive");
        }
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(ttl).truncatedTo(ChronoUnit.SECONDS);
        if (!expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("Token ttl must be at least one second");
        }

        String token = Jwts.builder()
                .setSubject(userId)
                .claim(EMAIL_CLAIM, email)
                .claim(NAME_CLAIM, displayName)
                .setIssuer(issuer)
                .setAudience(audience)
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(expiresAt))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
        return new IssuedToken(token, issuedAt, expiresAt);
    }

    /**
     * Parse and validate a JWT.
     *
     * This method performs:
     * 1. Base64 decoding of header, payload, and signature
     * 2. Signature verification using the signing key
     * 3. Expiry check against the injected clock, with zero skew
     * 4. Issuer and audience checks
     *
     * A token whose segments no longer decode after tampering is still
     * reported as INVALID_SIGNATURE when its signature does not match the
     * signed text; MALFORMED is reserved for input that is not a signed JWT.
     * The signature segment must also be the exact base64url encoding of the
     * MAC: the unused low bits of its last character may not differ.
     *
     * @param token The compact JWT (without "Bearer " prefix)
     * @return verified claims, or the rejection reason
     */
    @Override
    public TokenValidation validate(String token) {
        if (token == null || token.isBlank()) {
            return TokenValidation.invalid(TokenError.MALFORMED);
        }
        try {
            Claims claims = parser.parseClaimsJws(token).getBody();
            if (!hasCanonicalSignature(token)) {
                return TokenValidation.invalid(TokenError.INVALID_SIGNATURE);
            }
            return TokenValidation.valid(toTokenClaims(claims));
        } catch (ExpiredJwtException e) {
            return TokenValidation.invalid(TokenError.EXPIRED);
        } catch (SecurityException e) {
            return TokenValidation.invalid(TokenError.INVALID_SIGNATURE);
        } catch (InvalidClaimException e) {
            if (Claims.ISSUER.equals(e.getClaimName())) {
                return TokenValidation.invalid(TokenError.INVALID_ISSUER);
            }
            if (Claims.AUDIENCE.equals(e.getClaimName())) {
                return TokenValidation.invalid(TokenError.INVALID_AUDIENCE);
            }
            return TokenValidation.invalid(TokenError.MALFORMED);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected unparseable token: {}", e.getMessage());
            return TokenValidation.invalid(
                    hasForeignSignature(token) ? TokenError.INVALID_SIGNATURE : TokenError.MALFORMED);
        }
    }

    private static TokenClaims toTokenClaims(Claims claims) {
        return TokenClaims.builder()
                .subject(claims.getSubject())
                .email(claims.get(EMAIL_CLAIM, String.class))
                .name(claims.get(NAME_CLAIM, String.class))
                .issuer(claims.getIssuer())
                .audience(claims.getAudience())
                .issuedAt(claims.getIssuedAt() == null ? null : claims.getIssuedAt().toInstant())
                .expiresAt(claims.getExpiration() == null ? null : claims.getExpiration().toInstant())
                .build();
    }

    /**
     * True when the token has the three-segment JWS shape but its signature
     * segment is not our HMAC over the first two segments.
     */
    private boolean hasForeignSignature(String token) {
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3 || parts[2].isEmpty()) {
            return false;
        }
        try {
            byte[] provided = Base64.getUrlDecoder().decode(parts[2]);
            if (!isCanonical(parts[2], provided)) {
                return true;
            }
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(signingKey.getEncoded(), "HmacSHA256"));
            byte[] expected = mac.doFinal((parts[0] + "." + parts[1]).getBytes(StandardCharsets.US_ASCII));
            return !MessageDigest.isEqual(expected, provided);
        } catch (IllegalArgumentException e) {
            return false;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }

    private static boolean hasCanonicalSignature(String token) {
        String signature = token.substring(token.lastIndexOf('.') + 1);
        try {
            return isCanonical(signature, Base64.getUrlDecoder().decode(signature));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean isCanonical(String segment, byte[] decoded) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(decoded).equals(segment);
    }
}
