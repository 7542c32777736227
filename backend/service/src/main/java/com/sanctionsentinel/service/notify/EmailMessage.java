package com.sanctionsentinel.service.notify;

import java.time.Instant;
import java.util.List;

public record EmailMessage(List<String> to, String subject, String body, Instant createdAt) {
    public EmailMessage {
        to = to == null ? List.of() : List.copyOf(to);
    }
}
