package com.mk.fx.qa.latency.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Thin JSON-over-HTTP client for the harness API. Adds global headers to every request and
 * serialises request bodies with {@link JsonUtil}. Does not retry.
 */
@Slf4j
public class HarnessHttpClient {

    /** Default request timeout in seconds. */
    private static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;

    /** The underlying Java HTTP client. */
    private final HttpClient httpClient;

    /** Global headers to be included in all requests. */
    private final Map<String, String> headers;

    /** Base URL of the harness, without trailing slash. */
    private final String baseUrl;

    private final Duration requestTimeout;

    public HarnessHttpClient(String baseUrl, int connTimeOutSeconds, Map<String, String> headers) {
        this(baseUrl, connTimeOutSeconds, DEFAULT_REQUEST_TIMEOUT_SECONDS, headers);
    }

    /**
     * @param baseUrl harness base URL, e.g. {@code http://localhost:8766}
     * @param connTimeOutSeconds connection timeout in seconds
     * @param requestTimeoutSeconds request timeout in seconds, unless a request overrides it
     * @param headers global headers to include in all requests
     */
    public HarnessHttpClient(
            String baseUrl,
            int connTimeOutSeconds,
            int requestTimeoutSeconds,
            Map<String, String> headers) {
        this.baseUrl = validateAndNormalizeBaseUrl(baseUrl);
        this.requestTimeout = Duration.ofSeconds(requestTimeoutSeconds);
        this.httpClient =
                HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(connTimeOutSeconds))
                        .build();
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();

        log.info(
                "HarnessHttpClient initialised - Base URL: {}, Connection timeout: {}s,"
                        + " Request timeout: {}s",
                this.baseUrl,
                connTimeOutSeconds,
                requestTimeoutSeconds);
    }

    /**
     * Executes a request synchronously. Error statuses are returned, not thrown.
     *
     * @throws HarnessClientException if the request cannot be built or sent
     */
    public ResponseData execute(Request request) {
        Objects.requireNonNull(request, "Request cannot be null");
        var timeout = request.getTimeout() != null ? request.getTimeout() : requestTimeout;
        try {
            var startTime = System.nanoTime();
            var httpRequest = buildHttpRequest(request, timeout);

            log.debug("Executing {} request to {}", request.getMethod(), httpRequest.uri());

            var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            var duration = (System.nanoTime() - startTime) / 1_000_000;

            log.debug("Request completed in {} ms with status {}", duration, response.statusCode());
            return buildResponseData(response, duration);

        } catch (HttpTimeoutException e) {
            throw new HarnessClientException(
                    "Request timed out after " + timeout.toSeconds() + "s: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new HarnessClientException("Error executing request: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HarnessClientException("Interrupted while executing request", e);
        }
    }

    /**
     * Executes a request and maps a 2xx body onto {@code type}.
     *
     * @return null for 204 or an empty body
     * @throws HarnessClientException for non-2xx statuses or an unreadable body
     */
    public <T> T executeForBody(Request request, Class<T> type) {
        var response = execute(request);
        if (!response.isSuccess()) {
            throw new HarnessClientException(
                    response.getStatusCode(),
                    request.getMethod()
                            + " "
                            + request.getPath()
                            + " failed with status "
                            + response.getStatusCode()
                            + ": "
                            + response.getBody());
        }
        if (response.getStatusCode() == 204
                || response.getBody() == null
                || response.getBody().isBlank()) {
            return null;
        }
        try {
            return JsonUtil.fromJson(response.getBody(), type);
        } catch (JsonProcessingException e) {
            throw new HarnessClientException(
                    "Unreadable " + type.getSimpleName() + " response: " + e.getMessage(), e);
        }
    }

    private HttpRequest buildHttpRequest(Request request, Duration timeout) {
        var url = baseUrl + (request.getPath() != null ? request.getPath() : "");
        if (request.getQuery() != null && !request.getQuery().isEmpty()) {
            url += "?" + buildQueryString(request.getQuery());
        }

        var requestBuilder = HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout);

        // global headers
        headers.forEach(requestBuilder::header);

        // request-specific headers override
        if (request.getHeaders() != null) {
            request.getHeaders().forEach(requestBuilder::setHeader);
        }

        if (request.getBody() != null) {
            try {
                var jsonBody = JsonUtil.toJson(request.getBody());
                requestBuilder
                        .method(
                                request.getMethod().name(),
                                HttpRequest.BodyPublishers.ofString(jsonBody))
                        .header("Content-Type", "application/json");
            } catch (JsonProcessingException e) {
                throw new HarnessClientException(
                        "Failed to serialize request body: " + e.getMessage(), e);
            }
        } else {
            requestBuilder.method(request.getMethod().name(), HttpRequest.BodyPublishers.noBody());
        }
        requestBuilder.header("Accept", "application/json");
        return requestBuilder.build();
    }

    private ResponseData buildResponseData(HttpResponse<String> response, long durationMs) {
        var result = new ResponseData();
        result.setStatusCode(response.statusCode());
        result.setHeaders(
                response.headers().map().entrySet().stream()
                        .collect(
                                Collectors.toMap(
                                        Map.Entry::getKey, e -> String.join(",", e.getValue()))));
        result.setBody(response.body());
        result.setResponseTimeMs(durationMs);
        return result;
    }

    private String buildQueryString(Map<String, String> query) {
        return query.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private String validateAndNormalizeBaseUrl(String baseUrl) {
        Objects.requireNonNull(baseUrl, "Base URL cannot be null");
        var trimmed = baseUrl.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Base URL cannot be empty");
        }
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
