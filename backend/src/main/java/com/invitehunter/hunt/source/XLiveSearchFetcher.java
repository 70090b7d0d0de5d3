package com.invitehunter.hunt.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.invitehunter.hunt.http.PoliteHttpClient;
import com.invitehunter.hunt.model.HttpFetchResult;
import com.invitehunter.hunt.model.PollSettings;
import com.invitehunter.hunt.model.SourcePost;

import java.util.List;
import java.util.Map;

/**
 * Reads an X live-search page through a text-rendering proxy and hands back the
 * whole page as a single record.
 */
public class XLiveSearchFetcher extends HttpSourceFetcher {
    static final int MAX_BODY_CHARS = 15000;

    private final String proxyPrefix;
    private final String searchUrl;
    private final String description;

    public XLiveSearchFetcher(
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        String proxyPrefix,
        String searchUrl,
        String description
    ) {
        super(httpClient, objectMapper);
        this.proxyPrefix = proxyPrefix == null ? "" : proxyPrefix.trim();
        this.searchUrl = searchUrl;
        this.description = description;
    }

    @Override
    public List<SourcePost> fetch(PollSettings settings) throws SourceFetchException {
        HttpFetchResult result = fetchRaw(proxyPrefix + searchUrl, Map.of(), Map.of(), settings);
        String body = result.body() == null ? "" : result.body();
        if (body.length() > MAX_BODY_CHARS) {
            body = body.substring(0, MAX_BODY_CHARS);
        }
        return List.of(new SourcePost(description, body, searchUrl));
    }

    public String getSearchUrl() {
        return searchUrl;
    }
}
