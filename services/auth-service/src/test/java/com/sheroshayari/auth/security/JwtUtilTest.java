package com.sheroshayari.auth.security;

import com.sheroshayari.auth.support.MutableClock;
import io.jsonwebtoken.security.WeakKeyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JwtUtil")
class JwtUtilTest {

    private static final String SECRET = "test-secret-key-that-is-at-least-32-characters-long";
    private static final String ISSUER = "SheroShayariAPI";
    private static final String AUDIENCE = "SheroShayariUsers";
    private static final String BASE64URL =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-_";

    private MutableClock clock;
    private JwtUtil jwtUtil;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T12:00:00.750Z"));
        jwtUtil = new JwtUtil(SECRET, ISSUER, AUDIENCE, clock);
    }

    @Nested
    @DisplayName("issue")
    class Issue {

        @Test
        @DisplayName("produces a token that validates immediately with all identity claims")
        void issuedTokenValidates() {
            IssuedToken issued = jwtUtil.issue("user-1", "a@x.com", "A", Duration.ofMinutes(60));

            TokenValidation validation = jwtUtil.validate(issued.getToken());

            assertThat(validation.isValid()).isTrue();
            TokenClaims claims = validation.getClaims();
            assertThat(claims.getSubject()).isEqualTo("user-1");
            assertThat(claims.getEmail()).isEqualTo("a@x.com");
            assertThat(claims.getName()).isEqualTo("A");
            assertThat(claims.getIssuer()).isEqualTo(ISSUER);
            assertThat(claims.getAudience()).isEqualTo(AUDIENCE);
            assertThat(claims.getIssuedAt()).isEqualTo(Instant.parse("2024-06-01T12:00:00Z"));
            assertThat(claims.getExpiresAt()).isEqualTo(Instant.parse("2024-06-01T13:00:00Z"));
        }

        @Test
        @DisplayName("reports the same iat/exp window that the token carries")
        void windowMatchesClaims() {
            IssuedToken issued = jwtUtil.issue("user-1", "a@x.com", "A", Duration.ofMinutes(60));

            assertThat(issued.getExpiresAt()).isAfter(issued.getIssuedAt());
            assertThat(Duration.between(issued.getIssuedAt(), issued.getExpiresAt())).isEqualTo(Duration.ofMinutes(60));
        }

        @Test
        @DisplayName("rejects a non-positive ttl")
        void rejectsNonPositiveTtl() {
            assertThatThrownBy(() -> jwtUtil.issue("user-1", "a@x.com", "A", Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> jwtUtil.issue("user-1", "a@x.com", "A", Duration.ofMinutes(-5)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("refuses a secret shorter than 256 bits")
        void rejectsWeakSecret() {
            assertThatThrownBy(() -> new JwtUtil("too-short", ISSUER, AUDIENCE, clock))
                    .isInstanceOf(WeakKeyException.class);
        }
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("accepts the token up to its exact expiry and rejects it one second later")
        void enforcesExpiryWithoutSkew() {
            IssuedToken issued = jwtUtil.issue("user-1", "a@x.com", "A", Duration.ofMinutes(60));

            clock.set(issued.getExpiresAt());
            assertThat(jwtUtil.validate(issued.getToken()).isValid()).isTrue();

            clock.advance(Duration.ofSeconds(1));
            TokenValidation validation = jwtUtil.validate(issued.getToken());
            assertThat(validation.isValid()).isFalse();
            assertThat(validation.getError()).isEqualTo(TokenError.EXPIRED);
        }

        @Test
        @DisplayName("reports INVALID_SIGNATURE when any signature character is altered, including the last")
        void alteredSignature() {
            String token = jwtUtil.issue("user-1", "a@x.com", "A", Duration.ofMinutes(60)).getToken();
            int signatureStart = token.lastIndexOf('.') + 1;

            for (int pos = signatureStart; pos < token.length(); pos++) {
                for (char c : BASE64URL.toCharArray()) {
                    if (c == token.charAt(pos)) {
                        continue;
                    }
                    String tampered = token.substring(0, pos) + c + token.substring(pos + 1);

                    assertThat(jwtUtil.validate(tampered).getError())
                            .as("signature char %d replaced by '%s'", pos - signatureStart, c)
                            .isEqualTo(TokenError.INVALID_SIGNATURE);
                }
            }
        }

        @Test
        @DisplayName("reports INVALID_SIGNATURE when a payload character is altered")
        void alteredPayload() {
            String token = jwtUtil.issue("user-1", "a@x.com", "A", Duration.ofMinutes(60)).getToken();

            String tampered = alterSegment(token, 1);

            assertThat(jwtUtil.validate(tampered).getError()).isEqualTo(TokenError.INVALID_SIGNATURE);
        }

        @Test
        @DisplayName("reports INVALID_SIGNATURE for a token signed with another key")
        void foreignKey() {
            JwtUtil other = new JwtUtil("another-secret-key-that-is-also-32-characters-long", ISSUER, AUDIENCE, clock);
            String token = other.issue("user-1", "a@x.com", "A", Duration.ofMinutes(60)).getToken();

            assertThat(jwtUtil.validate(token).getError()).isEqualTo(TokenError.INVALID_SIGNATURE);
        }

        @Test
        @DisplayName("reports INVALID_ISSUER for a token from another issuer")
        void wrongIssuer() {
            JwtUtil other = new JwtUtil(SECRET, "SomeoneElse", AUDIENCE, clock);
            String token = other.issue("user-1", "a@x.com", "A", Duration.ofMinutes(60)).getToken();

            assertThat(jwtUtil.validate(token).getError()).isEqualTo(TokenError.INVALID_ISSUER);
        }

        @Test
        @DisplayName("reports INVALID_AUDIENCE for a token meant for another audience")
        void wrongAudience() {
            JwtUtil other = new JwtUtil(SECRET, ISSUER, "OtherClients", clock);
            String token = other.issue("user-1", "a@x.com", "A", Duration.ofMinutes(60)).getToken();

            assertThat(jwtUtil.validate(token).getError()).isEqualTo(TokenError.INVALID_AUDIENCE);
        }

        @Test
        @DisplayName("reports MALFORMED for input that is not a signed JWT")
        void malformed() {
            assertThat(jwtUtil.validate("not-a-jwt").getError()).isEqualTo(TokenError.MALFORMED);
            assertThat(jwtUtil.validate("").getError()).isEqualTo(TokenError.MALFORMED);
            assertThat(jwtUtil.validate(null).getError()).isEqualTo(TokenError.MALFORMED);
        }

        @Test
        @DisplayName("reports MALFORMED for an unsigned token")
        void unsigned() {
            String token = jwtUtil.issue("user-1", "a@x.com", "A", Duration.ofMinutes(60)).getToken();
            String unsigned = token.substring(0, token.lastIndexOf('.') + 1);

            assertThat(jwtUtil.validate(unsigned).getError()).isEqualTo(TokenError.MALFORMED);
        }
    }

    private static String alterSegment(String token, int segment) {
        String[] parts = token.split("\\.");
        char[] chars = parts[segment].toCharArray();
        int i = chars.length / 2;
        chars[i] = chars[i] == 'A' ? 'B' : 'A';
        parts[segment] = new String(chars);
        return String.join(".", parts);
    }
}
