package com.invitehunter.hunt.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invitehunter.hunt.http.PoliteHttpClient;
import com.invitehunter.hunt.model.HttpFetchResult;
import com.invitehunter.hunt.model.PollSettings;
import com.invitehunter.hunt.util.ReasonCodeClassifier;

import java.util.Map;

abstract class HttpSourceFetcher implements SourceFetcher {
    private static final int MAX_MESSAGE_LENGTH = 300;

    protected final PoliteHttpClient httpClient;
    protected final ObjectMapper objectMapper;

    protected HttpSourceFetcher(PoliteHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    protected HttpFetchResult fetchRaw(
        String url,
        Map<String, ?> params,
        Map<String, String> headers,
        PollSettings settings
    ) throws SourceFetchException {
        HttpFetchResult result = httpClient.get(url, params, headers, settings.userAgent());
        if (!result.isSuccessful()) {
            throw failure(result);
        }
        return result;
    }

    protected JsonNode fetchJson(
        String url,
        Map<String, ?> params,
        Map<String, String> headers,
        PollSettings settings
    ) throws SourceFetchException {
        HttpFetchResult result = fetchRaw(url, params, headers, settings);
        String body = result.body();
        if (body == null || body.isBlank()) {
            throw new SourceFetchException(
                ReasonCodeClassifier.PARSING_FAILED,
                "empty response body from " + result.finalUrlOrRequested()
            );
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SourceFetchException(
                ReasonCodeClassifier.PARSING_FAILED,
                "malformed JSON from " + result.finalUrlOrRequested(),
                e
            );
        }
    }

    protected static String text(JsonNode node, String field) {
        if (node == null) {
            return "";
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return "";
        }
        return value.asText("");
    }

    protected static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    private static SourceFetchException failure(HttpFetchResult result) {
        String reason = ReasonCodeClassifier.classify(result);
        String detail;
        if (result.errorCode() != null) {
            detail = result.errorCode() + (result.errorMessage() == null ? "" : ": " + result.errorMessage());
        } else {
            detail = "HTTP " + result.statusCode();
        }
        String message = reason + " (" + detail + ") from " + result.requestedUrl();
        if (message.length() > MAX_MESSAGE_LENGTH) {
            message = message.substring(0, MAX_MESSAGE_LENGTH);
        }
        return new SourceFetchException(reason, message);
    }
}
