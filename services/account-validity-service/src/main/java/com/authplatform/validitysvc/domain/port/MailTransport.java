package com.authplatform.validitysvc.domain.port;

public interface MailTransport {

    /**
     * Sends one message with an HTML and a plain text alternative.
     *
     * @return true if the message was handed to the mail server
     */
    boolean send(String address, String subject, String htmlBody, String textBody);
}
