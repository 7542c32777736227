package com.sanctionsentinel.service.notify;

import com.sanctionsentinel.core.model.ChangeType;
import com.sanctionsentinel.core.model.RiskLevel;
import com.sanctionsentinel.service.support.TestEntities;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EmailNotificationChannelTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void appendsMessagesToDevOutbox() throws Exception {
        Path outbox = Files.createTempDirectory("sanctions-outbox").resolve("mail/outbox.json");
        DevOutboxEmailSender sender = new DevOutboxEmailSender(outbox);
        EmailNotificationChannel channel = new EmailNotificationChannel(sender, List.of("compliance@example.com"));
        NotificationFormatter formatter = new NotificationFormatter();

        channel.send(formatter.criticalAlert(
                TestEntities.event("c1", "ofac_1", ChangeType.REMOVED, RiskLevel.CRITICAL), NOW));
        channel.send(formatter.digest(RiskLevel.LOW,
                List.of(TestEntities.event("l1", "ofac_1", ChangeType.MODIFIED, RiskLevel.LOW)), NOW));

        List<EmailMessage> messages = sender.messages();
        assertEquals(2, messages.size());
        assertEquals(List.of("compliance@example.com"), messages.get(0).to());
        assertTrue(messages.get(0).subject().startsWith("[CRITICAL]"));
        assertEquals("[LOW] Sanctions digest: 1 change", messages.get(1).subject());
        assertEquals(NOW, messages.get(1).createdAt());
    }

    @Test
    void senderFailureIsRetryable() {
        EmailNotificationChannel channel = new EmailNotificationChannel(message -> {
            throw new IOException("smtp unavailable");
        }, List.of("compliance@example.com"));

        NotificationException failure = assertThrows(NotificationException.class, () -> channel.send(
                new NotificationFormatter().criticalAlert(
                        TestEntities.event("c1", "ofac_1", ChangeType.REMOVED, RiskLevel.CRITICAL), NOW)));

        assertTrue(failure.retryable());
        assertTrue(failure.getMessage().contains("smtp unavailable"));
    }

    @Test
    void requiresRecipients() {
        assertThrows(IllegalArgumentException.class,
                () -> new EmailNotificationChannel(message -> { }, List.of()));
    }
}
