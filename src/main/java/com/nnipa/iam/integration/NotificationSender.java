package com.nnipa.iam.integration;

/**
 * Outbound delivery of messages to an address (email).
 */
public interface NotificationSender {

    void send(String toAddress, String subject, String body);
}
