package com.invitehunter.hunt.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invitehunter.hunt.http.PoliteHttpClient;
import com.invitehunter.hunt.model.PollSettings;
import com.invitehunter.hunt.model.SourcePost;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Latest topics of a Discourse forum (title plus excerpt).
 */
public class DiscourseLatestFetcher extends HttpSourceFetcher {
    private final String baseUrl;

    public DiscourseLatestFetcher(PoliteHttpClient httpClient, ObjectMapper objectMapper, String baseUrl) {
        super(httpClient, objectMapper);
        this.baseUrl = RedditListingFetcher.trimTrailingSlash(baseUrl);
    }

    @Override
    public List<SourcePost> fetch(PollSettings settings) throws SourceFetchException {
        JsonNode root = fetchJson(baseUrl + "/latest.json", Map.of(), Map.of(), settings);

        List<SourcePost> posts = new ArrayList<>();
        for (JsonNode topic : root.path("topic_list").path("topics")) {
            if (posts.size() >= settings.maxPostsPerSource()) {
                break;
            }
            String slug = text(topic, "slug");
            String id = text(topic, "id");
            String url = "";
            if (!slug.isEmpty() && !id.isEmpty()) {
                url = baseUrl + "/t/" + slug + "/" + id;
            }
            posts.add(new SourcePost(text(topic, "title"), text(topic, "excerpt"), url));
        }
        return posts;
    }
}
