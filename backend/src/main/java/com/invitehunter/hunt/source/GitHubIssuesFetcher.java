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

public class GitHubIssuesFetcher extends HttpSourceFetcher {
    static final int MAX_PER_PAGE = 30;

    private final String searchUrl;
    private final String query;

    public GitHubIssuesFetcher(PoliteHttpClient httpClient, ObjectMapper objectMapper, String searchUrl, String query) {
        super(httpClient, objectMapper);
        this.searchUrl = searchUrl;
        this.query = query;
    }

    @Override
    public List<SourcePost> fetch(PollSettings settings) throws SourceFetchException {
        int limit = Math.min(settings.maxPostsPerSource(), MAX_PER_PAGE);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("q", query);
        params.put("sort", "created");
        params.put("order", "desc");
        params.put("per_page", limit);

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "application/vnd.github+json");
        if (settings.hasGithubToken()) {
            headers.put("Authorization", "token " + settings.githubToken());
        }
        JsonNode root = fetchJson(searchUrl, params, headers, settings);

        List<SourcePost> posts = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            if (posts.size() >= limit) {
                break;
            }
            posts.add(new SourcePost("GitHub: " + text(item, "title"), text(item, "body"), text(item, "html_url")));
        }
        return posts;
    }
}
