package com.sanctionsentinel.sources.api;

/**
 * Raised by adapters. {@link Level#RECORD} failures are collected and skipped; {@link Level#FORMAT}
 * failures mean the payload as a whole is unusable and fail the run.
 */
public class ParseException extends Exception {
    public enum Level {
        RECORD,
        FORMAT
    }

    private final Level level;
    private final String field;
    private final String reason;

    public ParseException(Level level, String field, String reason) {
        this(level, field, reason, null);
    }

    public ParseException(Level level, String field, String reason, Throwable cause) {
        super(level.name().toLowerCase(java.util.Locale.ROOT) + " error" + (field == null ? "" : " in " + field) + ": " + reason, cause);
        this.level = level;
        this.field = field;
        this.reason = reason;
    }

    public static ParseException record(String field, String reason) {
        return new ParseException(Level.RECORD, field, reason);
    }

    public static ParseException format(String reason) {
        return new ParseException(Level.FORMAT, null, reason);
    }

    public static ParseException format(String reason, Throwable cause) {
        return new ParseException(Level.FORMAT, null, reason, cause);
    }

    public Level level() {
        return level;
    }

    public String field() {
        return field;
    }

    public String reason() {
        return reason;
    }
}
