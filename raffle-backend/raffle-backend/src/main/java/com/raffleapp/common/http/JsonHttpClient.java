package com.raffleapp.common.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Minimal JSON-over-https poster shared by the oracle and payout adapters.
 * Failures surface as {@link JsonHttpException}; callers decide how to report them.
 */
public class JsonHttpClient {

    private static final int MAX_RESPONSE_BYTES = 1_048_576;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public JsonHttpClient(ObjectMapper objectMapper, Duration connectTimeout, Duration requestTimeout) {
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    public JsonNode post(String url, Object body, Map<String, String> headers) {
        URI uri = validateUri(url);

        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new JsonHttpException("Failed to encode request body: " + safeMsg(e), 0, e);
        }

        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header("User-Agent", "RaffleApp/1.0")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));

        if (headers != null) {
            for (Map.Entry<String, String> e : headers.entrySet()) {
                if (e.getKey() != null && e.getValue() != null) {
                    req.header(e.getKey(), e.getValue());
                }
            }
        }

        HttpResponse<byte[]> resp;
        try {
            resp = httpClient.send(req.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JsonHttpException("Interrupted while calling " + uri.getHost(), 0, e);
        } catch (IOException e) {
            throw new JsonHttpException("Failed to call " + uri.getHost() + ": " + safeMsg(e), 0, e);
        }

        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new JsonHttpException("Call to " + uri.getHost() + " failed with status=" + status, status, null);
        }

        byte[] bytes = resp.body();
        if (bytes == null || bytes.length == 0) {
            return objectMapper.createObjectNode();
        }
        if (bytes.length > MAX_RESPONSE_BYTES) {
            throw new JsonHttpException("Response exceeds " + MAX_RESPONSE_BYTES + " bytes", status, null);
        }

        try {
            return objectMapper.readTree(bytes);
        } catch (IOException e) {
            throw new JsonHttpException("Malformed JSON response: " + safeMsg(e), status, e);
        }
    }

    private static URI validateUri(String url) {
        if (url == null || url.isBlank()) {
            throw new JsonHttpException("endpoint is not configured", 0, null);
        }
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw new JsonHttpException("Invalid endpoint: " + url, 0, e);
        }
        if (uri.getScheme() == null || !"https".equals(uri.getScheme().toLowerCase(Locale.ROOT))) {
            throw new JsonHttpException("Only https endpoints are allowed", 0, null);
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new JsonHttpException("Endpoint host is missing", 0, null);
        }
        return uri;
    }

    static String safeMsg(Exception e) {
        if (e == null) return "unknown";
        String m = e.getMessage();
        return (m == null || m.isBlank()) ? e.getClass().getSimpleName() : m;
    }
}
