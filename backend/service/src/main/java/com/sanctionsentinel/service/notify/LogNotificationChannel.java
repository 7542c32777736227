package com.sanctionsentinel.service.notify;

import java.util.logging.Level;
import java.util.logging.Logger;

public class LogNotificationChannel implements NotificationChannel {
    private static final Logger LOGGER = Logger.getLogger(LogNotificationChannel.class.getName());

    @Override
    public String id() {
        return "log";
    }

    @Override
    public void send(NotificationPayload payload) {
        Level level = switch (payload.riskLevel()) {
            case CRITICAL -> Level.SEVERE;
            case HIGH -> Level.WARNING;
            case MEDIUM, LOW -> Level.INFO;
        };
        LOGGER.log(level, payload.text());
    }
}
