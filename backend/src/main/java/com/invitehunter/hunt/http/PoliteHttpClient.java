package com.invitehunter.hunt.http;

import com.invitehunter.config.HunterProperties;
import com.invitehunter.hunt.model.HttpFetchResult;
import com.invitehunter.hunt.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;

@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);

    static final String DEFAULT_ACCEPT =
        "text/html,application/xhtml+xml,application/xml;q=0.9,application/json;q=0.8,*/*;q=0.7";

    private final HunterProperties properties;
    private final HttpClient client;

    public PoliteHttpClient(
        HunterProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String url, String userAgent) {
        return get(url, Map.of(), Map.of(), userAgent);
    }

    public HttpFetchResult get(String url, Map<String, ?> queryParams, Map<String, String> headers, String userAgent) {
        Instant startedAt = Instant.now();
        URI uri = buildUri(url, queryParams);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, 1, "invalid_url", "URL missing host or malformed");
        }
        Map<String, String> merged = mergeHeaders(uri, headers, userAgent);

        int maxAttempts = Math.max(1, 1 + properties.getRequestMaxRetries());
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(uri, merged, attempt);
            if (!ReasonCodeClassifier.isRetryable(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            log.warn(
                "Request failed (attempt {}/{}) for {}: {}",
                attempt,
                maxAttempts,
                uri,
                describe(lastResult)
            );
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private HttpFetchResult executeOnce(URI uri, Map<String, String> headers, int attempt) {
        Instant startedAt = Instant.now();
        String url = uri.toString();
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .GET();
            headers.forEach(builder::header);

            HttpResponse<byte[]> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            String responseBody = responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8);
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                responseBody,
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                attempt,
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, attempt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, attempt, "io_error", e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, attempt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, attempt, "http_error", e.getMessage());
        }
    }

    static Map<String, String> mergeHeaders(URI uri, Map<String, String> overrides, String userAgent) {
        Map<String, String> merged = new LinkedHashMap<>();
        merged.put("User-Agent", HunterProperties.normalizeUserAgent(userAgent));
        merged.put("Accept", DEFAULT_ACCEPT);
        merged.put("Accept-Language", "en-US,en;q=0.9");
        merged.put("Cache-Control", "no-cache");
        merged.put("Pragma", "no-cache");
        merged.put("Referer", uri.toString());
        if (overrides != null) {
            overrides.forEach((name, value) -> {
                if (name != null && value != null) {
                    merged.put(name, value);
                }
            });
        }
        return merged;
    }

    static URI buildUri(String url, Map<String, ?> queryParams) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            if (queryParams == null || queryParams.isEmpty()) {
                return URI.create(url.trim());
            }
            UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(url.trim());
            queryParams.forEach((name, value) -> {
                if (value != null) {
                    builder.queryParam(name, value);
                }
            });
            return builder.build().encode().toUri();
        } catch (IllegalArgumentException | IllegalStateException e) {
            return null;
        }
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRequestRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getRequestRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String describe(HttpFetchResult result) {
        if (result.errorCode() != null) {
            return result.errorCode() + (result.errorMessage() == null ? "" : " (" + result.errorMessage() + ")");
        }
        return "HTTP " + result.statusCode();
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, int attempt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            attempt,
            code,
            message
        );
    }
}
