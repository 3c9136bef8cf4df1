package com.elssolution.seneccollector.integration.senec;

import com.elssolution.seneccollector.domain.RawStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * HTTP client for the SENEC local web API: posts the section request to lala.cgi
 * and hands back the JSON answer untouched. No value decoding here.
 */
@Slf4j
public class SenecClient implements StatusSource {

    private static final String CONTENT_TYPE_JSON = "application/json";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String scheme;        // "http" on stock firmware, "https" on newer units
    private final String path;          // usually /lala.cgi
    private final Duration requestTimeout;
    private final String requestBody;

    public SenecClient(HttpClient httpClient,
                       ObjectMapper objectMapper,
                       String scheme,
                       String path,
                       Duration requestTimeout,
                       String requestBody) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.scheme = scheme;
        this.path = path;
        this.requestTimeout = requestTimeout;
        this.requestBody = requestBody;
    }

    @Override
    public CompletableFuture<List<RawStatus>> request(String host) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(scheme + "://" + host + safePath(path)))
                .header("Accept", CONTENT_TYPE_JSON)
                .header("Content-Type", CONTENT_TYPE_JSON)
                .header("User-Agent", "SenecCollector/1.0")
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        return httpClient.sendAsync(req, HttpResponse.BodyHandlers.ofString())
                .thenApply(resp -> List.of(toStatus(host, resp)));
    }

    private RawStatus toStatus(String host, HttpResponse<String> resp) {
        int sc = resp.statusCode();
        if (sc != 200) {
            throw new CompletionException(new FetchException(
                    "HTTP " + sc + " from " + host + " — " + truncate(resp.body(), 240)));
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(resp.body() == null ? "" : resp.body());
        } catch (JsonProcessingException e) {
            throw new CompletionException(new FetchException(
                    "Unreadable JSON from " + host + ": " + e.getOriginalMessage(), e));
        }
        if (root == null || !root.isObject()) {
            throw new CompletionException(new FetchException("Response from " + host + " is not a JSON object"));
        }
        if (log.isTraceEnabled()) log.trace("senec_raw host={} body={}", host, truncate(resp.body(), 500));
        return RawStatus.of(root);
    }

    private static String safePath(String p) {
        if (p == null || p.isBlank()) return "/";
        return p.startsWith("/") ? p : "/" + p;
    }

    private static String truncate(String s, int limit) {
        if (s == null) return "";
        return s.length() <= limit ? s : s.substring(0, Math.max(0, limit)) + "…";
    }
}
