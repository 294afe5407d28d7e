package com.sift.analytics.sink;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sift.analytics.AnalyticsJson;
import com.sift.analytics.AnalyticsRecord;
import com.sift.analytics.AnalyticsSink;
import com.sift.analytics.RecordType;
import com.sift.analytics.SinkException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Delivery client posting records in batches to the analytics endpoint.
 * <p>
 * Records are buffered by {@link #push} and sent by {@link #flush} as one request to
 * {@code <endpoint>/v1/batch}:
 * <pre>
 * {"batch": [{"type": "track", "userId": .., "event": .., "properties": {..}, "timestamp": ..}, ..],
 *  "sentAt": "2024-05-01T10:00:00Z"}
 * </pre>
 * authenticated with HTTP basic auth, the write key being the user name. A buffer that reaches
 * {@code maxBatchSize} is flushed on the next push. The buffer is cleared before sending, so a
 * failed request loses its records.
 */
public final class HttpBatchSink implements AnalyticsSink {

    public static final int DEFAULT_MAX_BATCH_SIZE = 500;
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    static final String BATCH_PATH = "/v1/batch";

    private final HttpClient client;
    private final URI batchUri;
    private final String authorization;
    private final int maxBatchSize;
    private final Clock clock;
    private final List<AnalyticsRecord> buffer = new ArrayList<>();

    HttpBatchSink(HttpClient client, URI batchUri, String writeKey, int maxBatchSize, Clock clock) {
        this.client = client;
        this.batchUri = batchUri;
        this.authorization = "Basic " + Base64.getEncoder()
                .encodeToString((writeKey + ":").getBytes(StandardCharsets.UTF_8));
        this.maxBatchSize = maxBatchSize;
        this.clock = clock;
    }

    /**
     * Builds a sink for the given endpoint.
     *
     * @param endpoint       base URL, e.g. {@code https://telemetry.example.com}
     * @param writeKey       key identifying the source at the endpoint
     * @param connectTimeout TCP connect timeout
     * @throws SinkException if the endpoint is not an absolute http(s) URL or the client cannot be built
     */
    public static HttpBatchSink create(String endpoint, String writeKey, Duration connectTimeout)
            throws SinkException {
        return create(endpoint, writeKey, connectTimeout, DEFAULT_MAX_BATCH_SIZE);
    }

    /**
     * Builds a sink with an explicit batch size.
     */
    public static HttpBatchSink create(
            String endpoint, String writeKey, Duration connectTimeout, int maxBatchSize) throws SinkException {
        if (writeKey == null || writeKey.isBlank()) {
            throw new SinkException("writeKey must not be null or blank");
        }
        if (maxBatchSize <= 0) {
            throw new SinkException("maxBatchSize must be positive");
        }
        URI batchUri = batchUri(endpoint);
        try {
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(connectTimeout != null ? connectTimeout : DEFAULT_CONNECT_TIMEOUT)
                    .build();
            return new HttpBatchSink(client, batchUri, writeKey, maxBatchSize, Clock.systemUTC());
        } catch (RuntimeException e) {
            throw new SinkException("Cannot build HTTP client for " + endpoint, e);
        }
    }

    static URI batchUri(String endpoint) throws SinkException {
        if (endpoint == null || endpoint.isBlank()) {
            throw new SinkException("endpoint must not be null or blank");
        }
        URI base;
        try {
            String trimmed = endpoint.endsWith("/")
                    ? endpoint.substring(0, endpoint.length() - 1)
                    : endpoint;
            base = URI.create(trimmed);
        } catch (IllegalArgumentException e) {
            throw new SinkException("Invalid analytics endpoint: " + endpoint, e);
        }
        String scheme = base.getScheme();
        boolean web = "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
        if (!web || base.getHost() == null) {
            throw new SinkException("Analytics endpoint must be an absolute http(s) URL: " + endpoint);
        }
        return URI.create(base + BATCH_PATH);
    }

    @Override
    public void push(AnalyticsRecord record) throws SinkException {
        boolean full;
        synchronized (buffer) {
            buffer.add(record);
            full = buffer.size() >= maxBatchSize;
        }
        if (full) {
            flush();
        }
    }

    @Override
    public void flush() throws SinkException {
        List<AnalyticsRecord> batch;
        synchronized (buffer) {
            if (buffer.isEmpty()) {
                return;
            }
            batch = new ArrayList<>(buffer);
            buffer.clear();
        }

        String body;
        try {
            body = AnalyticsJson.write(batchBody(batch, clock.instant()));
        } catch (AnalyticsJson.SerializationException e) {
            throw new SinkException("Cannot serialize analytics batch", e);
        }

        HttpRequest request = HttpRequest.newBuilder(batchUri)
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .header("Authorization", authorization)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        HttpResponse<Void> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.discarding());
        } catch (IOException e) {
            throw new SinkException("Analytics batch delivery failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SinkException("Interrupted while delivering analytics batch", e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new SinkException("Analytics endpoint answered HTTP " + response.statusCode());
        }
    }

    /** Records waiting for the next flush. */
    public int buffered() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    /**
     * JSON body of one batch request.
     */
    static ObjectNode batchBody(List<AnalyticsRecord> records, Instant sentAt) {
        ObjectNode body = AnalyticsJson.object();
        ArrayNode batch = body.putArray("batch");
        records.forEach(record -> batch.add(toJson(record)));
        body.put("sentAt", sentAt.toString());
        return body;
    }

    static ObjectNode toJson(AnalyticsRecord record) {
        ObjectNode node = AnalyticsJson.object();
        node.put("type", record.type().value());
        node.put("userId", record.userId());
        if (record.type() == RecordType.TRACK) {
            node.put("event", record.event());
            node.set("properties", record.payload());
        } else {
            node.set("traits", record.payload());
        }
        if (record.context() != null) {
            node.set("context", record.context());
        }
        record.explicitTimestamp().ifPresent(timestamp -> node.put("timestamp", timestamp.toString()));
        return node;
    }
}
