package com.sanctionsentinel.service.notify;

import com.sanctionsentinel.core.model.ChangeEvent;
import com.sanctionsentinel.core.model.ChangeType;
import com.sanctionsentinel.core.model.RiskLevel;
import com.sanctionsentinel.core.model.SanctionsSource;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders change events into the two message shapes sent to every channel.
 */
public class NotificationFormatter {
    static final int DIGEST_SUMMARY_LIMIT = 10;

    public NotificationPayload criticalAlert(ChangeEvent event, Instant now) {
        String action = switch (event.changeType()) {
            case ADDED -> "added to";
            case REMOVED -> "removed from";
            case MODIFIED -> "modified on";
        };
        String sourceName = event.source() == null ? "unknown source" : event.source().fullName();
        String subject = "[CRITICAL] " + event.entityName() + " " + action + " " + sourceLabel(event.source()) + " list";
        String text = subject + "\n"
                + "Entity: " + event.entityName() + " (" + event.entityUid() + ")\n"
                + "Action: " + event.changeType().name().toLowerCase(Locale.ROOT) + "\n"
                + "Source: " + sourceName + "\n"
                + "Summary: " + event.changeSummary() + "\n"
                + "Detected: " + event.detectedAt() + "\n"
                + "Run: " + event.runId();
        return new NotificationPayload(NotificationPayload.Kind.CRITICAL_ALERT, RiskLevel.CRITICAL, subject, text,
                List.of(event), now);
    }

    public NotificationPayload digest(RiskLevel tier, List<ChangeEvent> events, Instant now) {
        String subject = "[" + tier + "] Sanctions digest: " + events.size() + " change" + (events.size() == 1 ? "" : "s");
        StringBuilder text = new StringBuilder(subject).append('\n');

        Map<SanctionsSource, Map<ChangeType, Integer>> counts = new TreeMap<>();
        for (ChangeEvent event : events) {
            counts.computeIfAbsent(event.source(), ignored -> new EnumMap<>(ChangeType.class))
                    .merge(event.changeType(), 1, Integer::sum);
        }
        counts.forEach((source, byType) -> {
            text.append(sourceLabel(source)).append(':');
            byType.forEach((type, count) -> text.append(' ')
                    .append(type.name().toLowerCase(Locale.ROOT)).append('=').append(count));
            text.append('\n');
        });

        events.stream()
                .limit(DIGEST_SUMMARY_LIMIT)
                .forEach(event -> text.append("- ").append(event.changeSummary()).append('\n'));
        if (events.size() > DIGEST_SUMMARY_LIMIT) {
            text.append("... and ").append(events.size() - DIGEST_SUMMARY_LIMIT).append(" more changes\n");
        }
        return new NotificationPayload(NotificationPayload.Kind.DIGEST, tier, subject, text.toString().stripTrailing(),
                events, now);
    }

    private static String sourceLabel(SanctionsSource source) {
        return source == null ? "UNKNOWN" : source.name();
    }
}
