package com.invitehunter.hunt.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invitehunter.hunt.http.PoliteHttpClient;
import com.invitehunter.hunt.model.SourcePost;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

abstract class RedditListingFetcher extends HttpSourceFetcher {
    protected final String baseUrl;

    protected RedditListingFetcher(PoliteHttpClient httpClient, ObjectMapper objectMapper, String baseUrl) {
        super(httpClient, objectMapper);
        this.baseUrl = trimTrailingSlash(baseUrl);
    }

    protected static Map<String, String> redditHeaders() {
        return Map.of(
            "Accept", "application/json, text/javascript, */*; q=0.01",
            "Referer", "https://www.reddit.com/"
        );
    }

    protected List<SourcePost> parseListing(JsonNode root, int limit) {
        List<SourcePost> posts = new ArrayList<>();
        for (JsonNode child : root.path("data").path("children")) {
            if (posts.size() >= limit) {
                break;
            }
            JsonNode data = child.path("data");
            if (!data.isObject()) {
                continue;
            }
            String permalink = text(data, "permalink");
            String url = permalink.isEmpty() ? text(data, "url") : baseUrl + permalink;
            posts.add(new SourcePost(text(data, "title"), text(data, "selftext"), url));
        }
        return posts;
    }

    static String trimTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
