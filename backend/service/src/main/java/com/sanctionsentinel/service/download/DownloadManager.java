package com.sanctionsentinel.service.download;

import com.sanctionsentinel.core.model.SanctionsSource;
import com.sanctionsentinel.sources.api.SourceFetchConfig;

import javax.net.ssl.SSLException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;

/**
 * Fetches raw publications over HTTP. Transient failures (timeouts, I/O errors, 5xx, 429) are
 * retried under the {@link RetryPolicy}; everything else fails on the first attempt. All
 * sources share one connection ceiling.
 */
public class DownloadManager implements Downloader {
    private static final Logger LOGGER = Logger.getLogger(DownloadManager.class.getName());
    private static final String USER_AGENT = "sanctions-sentinel/0.1";

    private final HttpClient httpClient;
    private final RetryPolicy retryPolicy;
    private final Semaphore connections;
    private final SourceRateLimiter rateLimiter;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public DownloadManager(HttpClient httpClient, RetryPolicy retryPolicy, int maxConcurrentDownloads) {
        this(httpClient, retryPolicy, maxConcurrentDownloads, Clock.systemUTC(), Sleeper.SYSTEM,
                () -> ThreadLocalRandom.current().nextDouble());
    }

    public DownloadManager(
            HttpClient httpClient,
            RetryPolicy retryPolicy,
            int maxConcurrentDownloads,
            Clock clock,
            Sleeper sleeper,
            DoubleSupplier random
    ) {
        if (maxConcurrentDownloads < 1) {
            throw new IllegalArgumentException("maxConcurrentDownloads must be at least 1");
        }
        this.httpClient = httpClient;
        this.retryPolicy = retryPolicy;
        this.connections = new Semaphore(maxConcurrentDownloads, true);
        this.rateLimiter = new SourceRateLimiter(clock, sleeper);
        this.sleeper = sleeper;
        this.random = random;
    }

    @Override
    public DownloadResult fetch(SourceFetchConfig config) {
        SanctionsSource source = config.source();
        HttpRequest request = buildRequest(config);
        long startedNanos = System.nanoTime();
        DownloadException lastFailure = null;

        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            Duration retryAfter = null;
            try {
                rateLimiter.acquire(source, config.minRequestInterval());
                HttpResponse<byte[]> response = send(request);
                int status = response.statusCode();
                if (status >= 200 && status < 300) {
                    byte[] body = decode(response);
                    long durationMillis = Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
                    int attempts = attempt;
                    LOGGER.info(() -> String.format("Downloaded %s from %s: %d bytes, status %d, %d attempt(s), %d ms",
                            source, config.url(), body.length, status, attempts, durationMillis));
                    return new DownloadResult(source, body, status, response.headers().map(),
                            response.headers().firstValue("Content-Type").orElse(null), attempt, durationMillis);
                }
                if (status == 429 || status >= 500) {
                    lastFailure = DownloadException.transientFailure(source, "HTTP " + status + " from " + config.url(),
                            status, attempt, null);
                    retryAfter = status == 429 ? retryAfter(response).orElse(null) : null;
                } else {
                    throw DownloadException.permanent(source, "HTTP " + status + " from " + config.url(), status, attempt, null);
                }
            } catch (HttpTimeoutException e) {
                lastFailure = DownloadException.transientFailure(source, "Timed out fetching " + config.url(), -1, attempt, e);
            } catch (SSLException e) {
                throw DownloadException.permanent(source, "TLS failure fetching " + config.url() + ": " + e.getMessage(),
                        -1, attempt, e);
            } catch (IOException e) {
                if (e.getCause() instanceof SSLException) {
                    throw DownloadException.permanent(source, "TLS failure fetching " + config.url() + ": "
                            + e.getCause().getMessage(), -1, attempt, e);
                }
                lastFailure = DownloadException.transientFailure(source,
                        "I/O error fetching " + config.url() + ": " + e.getMessage(), -1, attempt, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw DownloadException.permanent(source, "Interrupted fetching " + config.url(), -1, attempt, e);
            }

            if (attempt < retryPolicy.maxAttempts()) {
                Duration delay = retryAfter != null
                        ? retryPolicy.capped(retryAfter)
                        : retryPolicy.delayBefore(attempt, random);
                LOGGER.warning(String.format("Attempt %d/%d for %s failed (%s); retrying in %d ms",
                        attempt, retryPolicy.maxAttempts(), source, lastFailure.getMessage(), delay.toMillis()));
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw DownloadException.permanent(source, "Interrupted while backing off for " + config.url(),
                            lastFailure.statusCode(), attempt, e);
                }
            } else {
                LOGGER.warning(String.format("Attempt %d/%d for %s failed (%s); giving up",
                        attempt, retryPolicy.maxAttempts(), source, lastFailure.getMessage()));
            }
        }
        throw lastFailure.withAttempts(retryPolicy.maxAttempts());
    }

    private HttpRequest buildRequest(SourceFetchConfig config) {
        URI uri;
        try {
            uri = URI.create(config.url());
        } catch (IllegalArgumentException e) {
            throw DownloadException.permanent(config.source(), "Invalid URL " + config.url(), -1, 0, e);
        }
        if (uri.getScheme() == null || !uri.getScheme().toLowerCase(Locale.ROOT).startsWith("http")) {
            throw DownloadException.permanent(config.source(), "Unsupported URL " + config.url(), -1, 0, null);
        }
        return HttpRequest.newBuilder(uri)
                .GET()
                .timeout(config.requestTimeout())
                .header("Accept", config.accept())
                .header("Accept-Encoding", "gzip")
                .header("User-Agent", USER_AGENT)
                .build();
    }

    private HttpResponse<byte[]> send(HttpRequest request) throws IOException, InterruptedException {
        connections.acquire();
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } finally {
            connections.release();
        }
    }

    private static byte[] decode(HttpResponse<byte[]> response) throws IOException {
        byte[] body = response.body() == null ? new byte[0] : response.body();
        boolean gzip = response.headers().firstValue("Content-Encoding")
                .map(value -> value.toLowerCase(Locale.ROOT).contains("gzip"))
                .orElse(false);
        if (!gzip || body.length == 0) {
            return body;
        }
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(body))) {
            return in.readAllBytes();
        }
    }

    static Optional<Duration> retryAfter(HttpResponse<?> response) {
        return response.headers().firstValue("Retry-After").flatMap(value -> {
            try {
                long seconds = Long.parseLong(value.trim());
                return seconds < 0 ? Optional.empty() : Optional.of(Duration.ofSeconds(seconds));
            } catch (NumberFormatException e) {
                LOGGER.fine(() -> "Ignoring non-numeric Retry-After header: " + value);
                return Optional.empty();
            }
        });
    }
}
