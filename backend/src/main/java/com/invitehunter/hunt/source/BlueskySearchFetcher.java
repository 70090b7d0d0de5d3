package com.invitehunter.hunt.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invitehunter.hunt.http.PoliteHttpClient;
import com.invitehunter.hunt.model.PollSettings;
import com.invitehunter.hunt.model.SourcePost;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class BlueskySearchFetcher extends HttpSourceFetcher {
    static final int MAX_LIMIT = 25;

    private final String searchUrl;
    private final String query;

    public BlueskySearchFetcher(PoliteHttpClient httpClient, ObjectMapper objectMapper, String searchUrl, String query) {
        super(httpClient, objectMapper);
        this.searchUrl = searchUrl;
        this.query = query;
    }

    @Override
    public List<SourcePost> fetch(PollSettings settings) throws SourceFetchException {
        int limit = Math.min(settings.maxPostsPerSource(), MAX_LIMIT);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("q", query);
        params.put("limit", limit);
        JsonNode root = fetchJson(searchUrl, params, Map.of(), settings);

        List<SourcePost> posts = new ArrayList<>();
        for (JsonNode post : root.path("posts")) {
            if (posts.size() >= limit) {
                break;
            }
            String author = text(post.path("author"), "handle");
            if (author.isEmpty()) {
                author = "unknown";
            }
            String uri = text(post, "uri");
            String url = "";
            if (!uri.isEmpty()) {
                url = "https://bsky.app/profile/" + author + "/post/" + uri.substring(uri.lastIndexOf('/') + 1);
            }
            posts.add(new SourcePost("Bluesky post by @" + author, text(post.path("record"), "text"), url));
        }
        return posts;
    }
}
