package com.agentbox.core.persistence;

import com.agentbox.core.metrics.DaemonMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for the core API's sandbox state and log endpoints.
 *
 * <p>Every POST is retried up to {@code attempts} times. Between attempts the
 * client waits {@code baseDelayMs * 2^(attempt-1)}. Non-2xx responses and I/O
 * errors both count as failed attempts; the last failure is thrown as a
 * {@link PersistenceException}.
 */
public class CoreApiClient {

    private static final Logger log = LoggerFactory.getLogger(CoreApiClient.class);

    static final String JSON = "application/json";
    static final String NDJSON = "application/x-ndjson";

    /** Pause between attempts; replaceable in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final int attempts;
    private final long baseDelayMs;
    private final Duration requestTimeout;
    private final Sleeper sleeper;
    private final DaemonMetrics metrics;

    public CoreApiClient(ObjectMapper objectMapper, int attempts, long baseDelayMs,
                         Duration requestTimeout, DaemonMetrics metrics) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                objectMapper, attempts, baseDelayMs, requestTimeout, Thread::sleep, metrics);
    }

    CoreApiClient(HttpClient httpClient, ObjectMapper objectMapper, int attempts, long baseDelayMs,
                  Duration requestTimeout, Sleeper sleeper, DaemonMetrics metrics) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.attempts = Math.max(1, attempts);
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.requestTimeout = requestTimeout;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * POSTs {@code body} serialized as JSON.
     *
     * @param url      absolute endpoint URL
     * @param body     any Jackson-serializable value
     * @param endpoint metrics tag, e.g. "state"
     */
    public void postJson(String url, Object body, String endpoint) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize body for " + url, e);
        }
        postWithRetry(url, json, JSON, endpoint);
    }

    public void postNdjson(String url, String ndjson, String endpoint) {
        postWithRetry(url, ndjson, NDJSON, endpoint);
    }

    public int attempts() {
        return attempts;
    }

    static long backoffDelay(long baseDelayMs, int attempt) {
        return baseDelayMs * (1L << (attempt - 1));
    }

    private void postWithRetry(String url, String body, String contentType, String endpoint) {
        var request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .header("Content-Type", contentType)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        Exception lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                if (response.statusCode() / 100 == 2) {
                    recordAttempt(endpoint, true);
                    log.debug("POST {} succeeded on attempt {}", url, attempt);
                    return;
                }
                lastError = new PersistenceException("POST %s failed (HTTP %d): %s"
                        .formatted(url, response.statusCode(), response.body()));
            } catch (IOException e) {
                lastError = e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PersistenceException("Interrupted while posting to " + url, e);
            }
            recordAttempt(endpoint, false);
            log.debug("POST {} attempt {}/{} failed: {}", url, attempt, attempts, lastError.getMessage());

            if (attempt < attempts && baseDelayMs > 0) {
                try {
                    sleeper.sleep(backoffDelay(baseDelayMs, attempt));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PersistenceException("Interrupted while waiting to retry " + url, e);
                }
            }
        }

        if (metrics != null) {
            metrics.recordPersistenceFailure(endpoint);
        }
        if (lastError instanceof PersistenceException persistenceError) {
            throw persistenceError;
        }
        throw new PersistenceException("POST %s failed after %d attempts".formatted(url, attempts), lastError);
    }

    private void recordAttempt(String endpoint, boolean success) {
        if (metrics != null) {
            metrics.recordPersistenceAttempt(endpoint, success);
        }
    }
}
