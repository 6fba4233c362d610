package com.sheroshayari.auth.email;

import com.sheroshayari.auth.config.AuthProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AuthEmailTemplatesTest {

    private final AuthEmailTemplates templates = new AuthEmailTemplates(new AuthProperties(
            "https://api.sheroshayari.com",
            "https://sheroshayari.com",
            false,
            null,
            new AuthProperties.PurposeToken("templates-test-secret-at-least-32-characters", 1, Duration.ofHours(24)),
            null,
            null));

    @Test
    @DisplayName("confirmation link targets the confirm-email endpoint")
    void confirmationLink() {
        assertThat(templates.confirmationLink("42", "abc_DEF-1"))
                .isEqualTo("https://api.sheroshayari.com/api/auth/confirm-email?userId=42&code=abc_DEF-1");
    }

    @Test
    @DisplayName("reset link encodes the email so '+' and '@' survive")
    void resetLinkEncodesEmail() {
        assertThat(templates.resetLink("poet+verse@x.com", "code"))
                .isEqualTo("https://sheroshayari.com/reset-password?email=poet%2Bverse%40x.com&code=code");
    }

    @Test
    @DisplayName("reset body escapes the display name and states the lifespan")
    void resetBody() {
        String body = templates.resetBody("<b>Ghalib</b>", "https://sheroshayari.com/reset-password?email=a&code=b");

        assertThat(body).contains("&lt;b&gt;Ghalib&lt;/b&gt;");
        assertThat(body).contains("email=a&amp;code=b");
        assertThat(body).contains("expire in 24 hours");
    }
}
