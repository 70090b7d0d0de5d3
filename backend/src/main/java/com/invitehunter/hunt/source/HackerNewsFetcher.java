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

/**
 * Algolia search over Hacker News stories and comments, newest first.
 */
public class HackerNewsFetcher extends HttpSourceFetcher {
    static final int MAX_HITS = 50;

    private final String searchUrl;

    public HackerNewsFetcher(PoliteHttpClient httpClient, ObjectMapper objectMapper, String searchUrl) {
        super(httpClient, objectMapper);
        this.searchUrl = searchUrl;
    }

    @Override
    public List<SourcePost> fetch(PollSettings settings) throws SourceFetchException {
        int limit = Math.min(settings.maxPostsPerSource(), MAX_HITS);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("query", settings.query());
        params.put("tags", "(story,comment)");
        params.put("hitsPerPage", limit);
        JsonNode root = fetchJson(searchUrl, params, Map.of(), settings);

        List<SourcePost> posts = new ArrayList<>();
        for (JsonNode hit : root.path("hits")) {
            if (posts.size() >= limit) {
                break;
            }
            String url = firstText(hit, "url", "story_url");
            String objectId = text(hit, "objectID");
            if (url.isEmpty() && !objectId.isEmpty()) {
                url = "https://news.ycombinator.com/item?id=" + objectId;
            }
            posts.add(new SourcePost(
                firstText(hit, "title", "story_title"),
                firstText(hit, "story_text", "comment_text"),
                url
            ));
        }
        return posts;
    }
}
