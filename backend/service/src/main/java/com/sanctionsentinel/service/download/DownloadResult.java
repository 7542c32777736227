package com.sanctionsentinel.service.download;

import com.sanctionsentinel.core.model.SanctionsSource;

import java.util.List;
import java.util.Map;

public record DownloadResult(
        SanctionsSource source,
        byte[] body,
        int statusCode,
        Map<String, List<String>> headers,
        String contentType,
        int attempts,
        long durationMillis
) {
    public DownloadResult {
        body = body == null ? new byte[0] : body;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public int retryCount() {
        return Math.max(0, attempts - 1);
    }

    public long sizeBytes() {
        return body.length;
    }
}
