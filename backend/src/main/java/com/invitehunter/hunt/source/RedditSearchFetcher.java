package com.invitehunter.hunt.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invitehunter.hunt.http.PoliteHttpClient;
import com.invitehunter.hunt.model.PollSettings;
import com.invitehunter.hunt.model.SourcePost;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Site-wide Reddit search. A null query searches for the configured
 * {@link PollSettings#query()} of the current cycle.
 */
public class RedditSearchFetcher extends RedditListingFetcher {
    private final String query;
    private final String timeWindow;

    public RedditSearchFetcher(
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        String baseUrl,
        String query,
        String timeWindow
    ) {
        super(httpClient, objectMapper, baseUrl);
        this.query = query;
        this.timeWindow = timeWindow == null || timeWindow.isBlank() ? "day" : timeWindow;
    }

    @Override
    public List<SourcePost> fetch(PollSettings settings) throws SourceFetchException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("q", query == null ? settings.query() : query);
        params.put("sort", "new");
        params.put("limit", settings.maxPostsPerSource());
        params.put("restrict_sr", false);
        params.put("t", timeWindow);
        JsonNode root = fetchJson(baseUrl + "/search.json", params, redditHeaders(), settings);
        return parseListing(root, settings.maxPostsPerSource());
    }

    public String getQuery() {
        return query;
    }

    public String getTimeWindow() {
        return timeWindow;
    }
}
