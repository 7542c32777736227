package com.sanctionsentinel.service.notify;

import java.io.IOException;
import java.util.List;

public class EmailNotificationChannel implements NotificationChannel {
    private final EmailSender sender;
    private final List<String> recipients;

    public EmailNotificationChannel(EmailSender sender, List<String> recipients) {
        if (recipients == null || recipients.isEmpty()) {
            throw new IllegalArgumentException("Email channel needs at least one recipient");
        }
        this.sender = sender;
        this.recipients = List.copyOf(recipients);
    }

    @Override
    public String id() {
        return "email";
    }

    @Override
    public void send(NotificationPayload payload) throws NotificationException {
        try {
            sender.send(new EmailMessage(recipients, payload.subject(), payload.text(), payload.createdAt()));
        } catch (IOException e) {
            throw new NotificationException("Email delivery failed: " + e.getMessage(), true, e);
        }
    }
}
