package com.nisfix.compliance.infrastructure.notify;

/**
 * Final delivery step for outgoing mail.
 */
public interface Mailer {

    void send(String to, String subject, String body);
}
