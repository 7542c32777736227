package com.sanctionsentinel.service.notify;

public class NotificationException extends Exception {
    private final boolean retryable;

    public NotificationException(String message, boolean retryable) {
        this(message, retryable, null);
    }

    public NotificationException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
