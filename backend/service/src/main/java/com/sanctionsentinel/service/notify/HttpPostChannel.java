package com.sanctionsentinel.service.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.sanctionsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Channels that deliver a JSON document by HTTP POST. 5xx, 429 and I/O failures are retryable;
 * any other non-2xx status is not.
 */
abstract class HttpPostChannel implements NotificationChannel {
    private final String id;
    private final HttpClient httpClient;
    private final URI endpoint;
    private final Duration timeout;

    HttpPostChannel(String id, HttpClient httpClient, URI endpoint, Duration timeout) {
        this.id = id;
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.timeout = timeout;
    }

    protected abstract Object body(NotificationPayload payload);

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(NotificationPayload payload) throws NotificationException {
        byte[] json;
        try {
            json = JsonUtils.objectMapper().writeValueAsBytes(body(payload));
        } catch (JsonProcessingException e) {
            throw new NotificationException("Unable to serialize " + id + " payload", false, e);
        }
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(json))
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new NotificationException(id + " delivery to " + endpoint + " failed: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException(id + " delivery interrupted", false, e);
        }
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return;
        }
        boolean retryable = status == 429 || status >= 500;
        throw new NotificationException(id + " endpoint " + endpoint + " answered HTTP " + status, retryable);
    }
}
