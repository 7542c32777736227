package com.sanctionsentinel.service.dedup;

import com.sanctionsentinel.core.model.ContentSnapshot;
import com.sanctionsentinel.core.model.SanctionsSource;
import com.sanctionsentinel.core.util.HashingUtils;
import com.sanctionsentinel.service.store.SanctionsRepository;

import java.util.Arrays;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides whether a freshly downloaded payload is byte-equivalent to the last processed one.
 * Payloads are normalized before hashing so that a BOM, line-ending style or trailing
 * whitespace never count as a change.
 */
public class ContentDeduplicator {
    private static final Logger LOGGER = Logger.getLogger(ContentDeduplicator.class.getName());

    private final SanctionsRepository repository;

    public ContentDeduplicator(SanctionsRepository repository) {
        this.repository = repository;
    }

    public String digest(byte[] raw) {
        return HashingUtils.sha256(normalize(raw));
    }

    public boolean shouldSkip(SanctionsSource source, byte[] raw) {
        return shouldSkip(source, digest(raw));
    }

    /**
     * True only when the latest snapshot for the source carries the same digest. A missing
     * snapshot or a failed lookup means the payload is processed.
     */
    public boolean shouldSkip(SanctionsSource source, String digest) {
        Optional<ContentSnapshot> latest;
        try {
            latest = repository.getLatestSnapshot(source);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Snapshot lookup failed for " + source + "; processing payload", e);
            return false;
        }
        boolean unchanged = latest.map(snapshot -> digest.equals(snapshot.contentHash())).orElse(false);
        if (unchanged) {
            LOGGER.info(() -> "Payload for " + source + " unchanged since run " + latest.get().runId());
        }
        return unchanged;
    }

    static byte[] normalize(byte[] raw) {
        if (raw == null || raw.length == 0) {
            return new byte[0];
        }
        int start = 0;
        if (raw.length >= 3 && (raw[0] & 0xFF) == 0xEF && (raw[1] & 0xFF) == 0xBB && (raw[2] & 0xFF) == 0xBF) {
            start = 3;
        }
        byte[] out = new byte[raw.length - start];
        int length = 0;
        for (int i = start; i < raw.length; i++) {
            byte b = raw[i];
            if (b == '\r') {
                out[length++] = '\n';
                if (i + 1 < raw.length && raw[i + 1] == '\n') {
                    i++;
                }
            } else {
                out[length++] = b;
            }
        }
        while (length > 0 && isWhitespace(out[length - 1])) {
            length--;
        }
        return Arrays.copyOf(out, length);
    }

    private static boolean isWhitespace(byte b) {
        return b == ' ' || b == '\t' || b == '\n' || b == '\r';
    }
}
