package com.sheroshayari.auth.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Type-safe configuration for the auth workflow, bound from the {@code auth.*} prefix.
 *
 * <pre>
 * auth:
 *   api-base-url: http://localhost:5000
 *   frontend-url: http://localhost:5160
 *   require-confirmed-email: false
 *   password:
 *     min-length: 6
 *     bcrypt-strength: 10
 *   purpose-token:
 *     secret: ${PURPOSE_TOKEN_SECRET}
 *     key-version: 1
 *     lifespan: 24h
 *   forgot-password:
 *     suppress-email-failures: false
 *   mail:
 *     sender-email: noreply@sheroshayari.com
 *     sender-name: SheroShayari
 * </pre>
 *
 * @param apiBaseUrl Public base URL of this service, used in email confirmation links.
 * @param frontendUrl Base URL of the single-page client, used in password reset links.
 * @param requireConfirmedEmail Reject logins from accounts that never confirmed their email.
 * @param password Password policy and hashing cost.
 * @param purposeToken Key material and lifespan of confirmation/reset tokens.
 * @param forgotPassword Error surfacing policy of the forgot-password flow.
 * @param mail From-address of outgoing auth emails.
 */
@ConfigurationProperties(prefix = "auth")
@Validated
public record AuthProperties(
        @NotBlank String apiBaseUrl,
        @NotBlank String frontendUrl,
        boolean requireConfirmedEmail,
        Password password,
        PurposeToken purposeToken,
        ForgotPassword forgotPassword,
        Mail mail) {

    public AuthProperties {
        if (password == null) {
            password = new Password(0, 0);
        }
        if (purposeToken == null) {
            purposeToken = new PurposeToken(null, 0, null);
        }
        if (forgotPassword == null) {
            forgotPassword = new ForgotPassword(false);
        }
        if (mail == null) {
            mail = new Mail(null, null);
        }
    }

    public record Password(int minLength, int bcryptStrength) {
        public Password {
            if (minLength <= 0) {
                minLength = 6;
            }
            if (bcryptStrength <= 0) {
                bcryptStrength = 10;
            }
        }
    }

    public record PurposeToken(String secret, int keyVersion, Duration lifespan) {
        public PurposeToken {
            if (keyVersion <= 0) {
                keyVersion = 1;
            }
            if (lifespan == null || lifespan.isZero() || lifespan.isNegative()) {
                lifespan = Duration.ofHours(24);
            }
        }
    }

    /**
     * @param suppressEmailFailures When true, SMTP failures are logged and the caller still
     *     receives the generic success response.
     */
    public record ForgotPassword(boolean suppressEmailFailures) {}

    public record Mail(String senderEmail, String senderName) {
        public Mail {
            if (senderEmail == null || senderEmail.isBlank()) {
                senderEmail = "noreply@sheroshayari.com";
            }
            if (senderName == null || senderName.isBlank()) {
                senderName = "SheroShayari";
            }
        }
    }
}
