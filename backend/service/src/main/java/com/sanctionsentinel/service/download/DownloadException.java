package com.sanctionsentinel.service.download;

import com.sanctionsentinel.core.model.SanctionsSource;

public class DownloadException extends RuntimeException {
    public enum Kind {
        TRANSIENT,
        PERMANENT
    }

    private final SanctionsSource source;
    private final Kind kind;
    private final int statusCode;
    private final int attempts;

    public DownloadException(SanctionsSource source, Kind kind, String message, int statusCode, int attempts, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.kind = kind;
        this.statusCode = statusCode;
        this.attempts = attempts;
    }

    public static DownloadException permanent(SanctionsSource source, String message, int statusCode, int attempts, Throwable cause) {
        return new DownloadException(source, Kind.PERMANENT, message, statusCode, attempts, cause);
    }

    public static DownloadException transientFailure(SanctionsSource source, String message, int statusCode, int attempts, Throwable cause) {
        return new DownloadException(source, Kind.TRANSIENT, message, statusCode, attempts, cause);
    }

    public DownloadException withAttempts(int totalAttempts) {
        return new DownloadException(source, kind,
                getMessage() + " (gave up after " + totalAttempts + " attempts)", statusCode, totalAttempts, getCause());
    }

    public SanctionsSource source() {
        return source;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }

    /** HTTP status of the last response, or -1 when no response was received. */
    public int statusCode() {
        return statusCode;
    }

    public int attempts() {
        return attempts;
    }

    public int retryCount() {
        return Math.max(0, attempts - 1);
    }
}
