package com.sheroshayari.auth.email;

import com.sheroshayari.auth.config.AuthProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Builds the links and HTML bodies of confirmation and password reset emails.
 *
 * Confirmation links point at this service's confirm-email endpoint; reset
 * links point at the client's reset page, which pre-validates the code.
 * Query values are expanded as strictly encoded URI variables so that a '+'
 * in an address survives the round trip.
 */
@Component
@RequiredArgsConstructor
public class AuthEmailTemplates {

    public static final String CONFIRM_SUBJECT = "Confirm your email";
    public static final String RESET_SUBJECT = "Reset your password - SheroShayari";

    private final AuthProperties properties;

    public String confirmationLink(String userId, String code) {
        return UriComponentsBuilder.fromHttpUrl(properties.apiBaseUrl())
                .path("/api/auth/confirm-email")
                .queryParam("userId", "{userId}")
                .queryParam("code", "{code}")
                .encode()
                .buildAndExpand(userId, code)
                .toUriString();
    }

    public String resetLink(String email, String code) {
        return UriComponentsBuilder.fromHttpUrl(properties.frontendUrl())
                .path("/reset-password")
                .queryParam("email", "{email}")
                .queryParam("code", "{code}")
                .encode()
                .buildAndExpand(email, code)
                .toUriString();
    }

    public String confirmationBody(String link) {
        return "<h2>Welcome to SheroShayari!</h2>"
                + "<p>Thank you for registering. Please confirm your email by clicking the link below:</p>"
                + "<p><a href='" + HtmlUtils.htmlEscape(link) + "'>Confirm Email</a></p>"
                + "<p>If you did not register, please ignore this email.</p>";
    }

    public String resetBody(String displayName, String link) {
        long hours = properties.purposeToken().lifespan().toHours();
        return "<h2>Password Reset Request</h2>"
                + "<p>Hello " + HtmlUtils.htmlEscape(displayName == null ? "" : displayName) + ",</p>"
                + "<p>We received a request to reset your password. Click the link below to create a new password:</p>"
                + "<p><a href='" + HtmlUtils.htmlEscape(link) + "'>Reset Password</a></p>"
                + "<p>This link will expire in " + hours + " hours.</p>"
                + "<p>If you did not request a password reset, please ignore this email.</p>"
                + "<p>Best regards,<br/>SheroShayari Team</p>";
    }
}
