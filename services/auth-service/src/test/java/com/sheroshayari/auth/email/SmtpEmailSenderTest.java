package com.sheroshayari.auth.email;

import com.sheroshayari.auth.config.AuthProperties;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SmtpEmailSenderTest {

    @Mock
    private ObjectProvider<JavaMailSender> provider;

    @Mock
    private JavaMailSender javaMailSender;

    private final AuthProperties properties =
            new AuthProperties("http://localhost:5000", "http://localhost:5160", false, null, null, null, null);

    @BeforeEach
    void setUp() {
        lenient().when(javaMailSender.createMimeMessage())
                .thenAnswer(inv -> new MimeMessage(Session.getInstance(new Properties())));
    }

    @Test
    @DisplayName("sends an HTML message from the configured sender")
    void sendsMessage() throws Exception {
        when(provider.getIfAvailable()).thenReturn(javaMailSender);
        SmtpEmailSender sender = new SmtpEmailSender(provider, properties, "smtp.example.com");

        sender.sendEmail("poet@x.com", "Confirm your email", "<p>hello</p>");

        ArgumentCaptor<MimeMessage> sent = ArgumentCaptor.forClass(MimeMessage.class);
        verify(javaMailSender).send(sent.capture());
        MimeMessage message = sent.getValue();
        assertThat(message.getSubject()).isEqualTo("Confirm your email");
        assertThat(((InternetAddress) message.getFrom()[0]).getAddress()).isEqualTo("noreply@sheroshayari.com");
        assertThat(((InternetAddress) message.getFrom()[0]).getPersonal()).isEqualTo("SheroShayari");
        assertThat(message.getAllRecipients()[0].toString()).isEqualTo("poet@x.com");
    }

    @Test
    @DisplayName("fails when no SMTP host is configured")
    void notConfigured() {
        when(provider.getIfAvailable()).thenReturn(javaMailSender);
        SmtpEmailSender sender = new SmtpEmailSender(provider, properties, "");

        assertThatThrownBy(() -> sender.sendEmail("poet@x.com", "s", "b"))
                .isInstanceOf(EmailDeliveryException.class)
                .hasMessageContaining("not configured");
        verify(javaMailSender, never()).send(any(MimeMessage.class));
    }

    @Test
    @DisplayName("fails when no mail sender bean exists")
    void noMailSender() {
        when(provider.getIfAvailable()).thenReturn(null);
        SmtpEmailSender sender = new SmtpEmailSender(provider, properties, "smtp.example.com");

        assertThatThrownBy(() -> sender.sendEmail("poet@x.com", "s", "b"))
                .isInstanceOf(EmailDeliveryException.class);
    }

    @Test
    @DisplayName("wraps transport failures")
    void wrapsTransportFailure() {
        when(provider.getIfAvailable()).thenReturn(javaMailSender);
        doThrow(new MailSendException("connection refused")).when(javaMailSender).send(any(MimeMessage.class));
        SmtpEmailSender sender = new SmtpEmailSender(provider, properties, "smtp.example.com");

        assertThatThrownBy(() -> sender.sendEmail("poet@x.com", "s", "b"))
                .isInstanceOf(EmailDeliveryException.class)
                .hasCauseInstanceOf(MailSendException.class);
    }

    @Test
    @DisplayName("strips line breaks before logging an address")
    void sanitize() {
        assertThat(SmtpEmailSender.sanitize("a@x.com\r\nINFO forged")).isEqualTo("a@x.comINFO forged");
        assertThat(SmtpEmailSender.sanitize(null)).isEmpty();
    }
}
