package com.invitehunter.hunt.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invitehunter.hunt.http.PoliteHttpClient;
import com.invitehunter.hunt.model.PollSettings;
import com.invitehunter.hunt.model.SourcePost;
import org.jsoup.Jsoup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MastodonSearchFetcher extends HttpSourceFetcher {
    static final int MAX_LIMIT = 20;

    private final String searchUrl;
    private final String query;

    public MastodonSearchFetcher(PoliteHttpClient httpClient, ObjectMapper objectMapper, String searchUrl, String query) {
        super(httpClient, objectMapper);
        this.searchUrl = searchUrl;
        this.query = query;
    }

    @Override
    public List<SourcePost> fetch(PollSettings settings) throws SourceFetchException {
        int limit = Math.min(settings.maxPostsPerSource(), MAX_LIMIT);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("q", query);
        params.put("type", "statuses");
        params.put("limit", limit);
        JsonNode root = fetchJson(searchUrl, params, Map.of(), settings);

        List<SourcePost> posts = new ArrayList<>();
        for (JsonNode status : root.path("statuses")) {
            if (posts.size() >= limit) {
                break;
            }
            String account = text(status.path("account"), "acct");
            if (account.isEmpty()) {
                account = "unknown";
            }
            posts.add(new SourcePost(
                "Mastodon post by @" + account,
                plainText(text(status, "content")),
                text(status, "url")
            ));
        }
        return posts;
    }

    static String plainText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text();
    }
}
