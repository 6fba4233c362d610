package com.sheroshayari.auth.email;

import com.sheroshayari.auth.config.AuthProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;

/**
 * SmtpEmailSender - {@link EmailSender} over Spring's {@link JavaMailSender}.
 *
 * SMTP settings come from {@code spring.mail.*} (host, port, username, password,
 * STARTTLS). When no host is configured every send fails with
 * {@link EmailDeliveryException}, the same failure as an unreachable server.
 */
@Component
@Slf4j
public class SmtpEmailSender implements EmailSender {

    private final ObjectProvider<JavaMailSender> mailSender;
    private final AuthProperties properties;
    private final String smtpHost;

    public SmtpEmailSender(
            ObjectProvider<JavaMailSender> mailSender,
            AuthProperties properties,
            @Value("${spring.mail.host:}") String smtpHost) {
        this.mailSender = mailSender;
        this.properties = properties;
        this.smtpHost = smtpHost;
    }

    @Override
    public void sendEmail(String to, String subject, String htmlBody) {
        String recipient = sanitize(to);
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null || smtpHost == null || smtpHost.isBlank()) {
            log.error("SMTP server not configured, cannot send '{}' to {}", subject, recipient);
            throw new EmailDeliveryException("SMTP server not configured");
        }

        try {
            MimeMessage message = sender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, StandardCharsets.UTF_8.name());
            helper.setFrom(properties.mail().senderEmail(), properties.mail().senderName());
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(htmlBody, true);

            log.info("Sending email to {} with subject '{}'", recipient, subject);
            sender.send(message);
            log.info("Email sent to {}", recipient);
        } catch (MailException e) {
            log.error("Failed to send email to {}", recipient, e);
            throw new EmailDeliveryException("Failed to send email", e);
        } catch (MessagingException | UnsupportedEncodingException e) {
            log.error("Could not build email for {}", recipient, e);
            throw new EmailDeliveryException("Could not build email", e);
        }
    }

    // Strip CR/LF so a crafted address cannot forge log lines.
    static String sanitize(String value) {
        if (value == null) return "";
        return value.replace("\r", "").replace("\n", "");
    }
}
