package com.sheroshayari.auth.email;

/**
 * Outbound email collaborator of the auth workflow.
 */
public interface EmailSender {

    /**
     * Send an HTML email.
     *
     * @throws EmailDeliveryException if the message could not be handed to the mail server
     */
    void sendEmail(String to, String subject, String htmlBody);
}
