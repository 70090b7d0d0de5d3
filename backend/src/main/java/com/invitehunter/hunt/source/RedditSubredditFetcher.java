package com.invitehunter.hunt.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invitehunter.hunt.http.PoliteHttpClient;
import com.invitehunter.hunt.model.PollSettings;
import com.invitehunter.hunt.model.SourcePost;

import java.util.List;
import java.util.Map;

public class RedditSubredditFetcher extends RedditListingFetcher {
    private final String subreddit;

    public RedditSubredditFetcher(PoliteHttpClient httpClient, ObjectMapper objectMapper, String baseUrl, String subreddit) {
        super(httpClient, objectMapper, baseUrl);
        if (subreddit == null || subreddit.isBlank()) {
            throw new IllegalArgumentException("subreddit is required");
        }
        this.subreddit = subreddit.trim();
    }

    @Override
    public List<SourcePost> fetch(PollSettings settings) throws SourceFetchException {
        String url = baseUrl + "/r/" + subreddit + "/new.json";
        JsonNode root = fetchJson(url, Map.of("limit", settings.maxPostsPerSource()), redditHeaders(), settings);
        return parseListing(root, settings.maxPostsPerSource());
    }

    public String getSubreddit() {
        return subreddit;
    }
}
