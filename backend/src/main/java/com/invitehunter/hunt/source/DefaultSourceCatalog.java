package com.invitehunter.hunt.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.invitehunter.config.HunterProperties;
import com.invitehunter.hunt.http.PoliteHttpClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public final class DefaultSourceCatalog {
    private DefaultSourceCatalog() {
    }

    public static List<SourceDescriptor> build(
        HunterProperties properties,
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        HunterProperties.Endpoints endpoints = properties.getEndpoints();
        String reddit = endpoints.getRedditBaseUrl();
        String proxy = endpoints.getSearchProxyPrefix();

        List<SourceDescriptor> sources = new ArrayList<>();
        sources.add(SourceDescriptor.of(
            "Reddit search (configured)",
            new RedditSearchFetcher(httpClient, objectMapper, reddit, null, "day")
        ));
        sources.add(SourceDescriptor.of(
            "Reddit search (Sora invite code)",
            new RedditSearchFetcher(httpClient, objectMapper, reddit, "Sora invite code", "week")
        ));
        sources.add(SourceDescriptor.of(
            "Reddit search (Sora beta access)",
            new RedditSearchFetcher(httpClient, objectMapper, reddit, "\"Sora\" \"beta\" \"access\"", "week")
        ));
        for (String subreddit : List.of("ChatGPT", "OpenAI", "SoraAI", "artificial")) {
            sources.add(SourceDescriptor.of(
                "Reddit /r/" + subreddit,
                new RedditSubredditFetcher(httpClient, objectMapper, reddit, subreddit)
            ));
        }
        sources.add(SourceDescriptor.of(
            "X live (Sora invite code)",
            new XLiveSearchFetcher(
                httpClient,
                objectMapper,
                proxy,
                "https://x.com/search?q=Sora%20invite%20code&f=live",
                "Live tweets: Sora invite code"
            )
        ).withDelay(Duration.ofSeconds(1)));
        sources.add(SourceDescriptor.of(
            "X live (#SoraInvite)",
            new XLiveSearchFetcher(
                httpClient,
                objectMapper,
                proxy,
                "https://x.com/search?q=%23SoraInvite&f=live",
                "Live tweets: #SoraInvite"
            )
        ).withDelay(Duration.ofSeconds(1)));
        sources.add(SourceDescriptor.of(
            "X live (#SoraAccess)",
            new XLiveSearchFetcher(
                httpClient,
                objectMapper,
                proxy,
                "https://x.com/search?q=%23SoraAccess&f=live",
                "Live tweets: #SoraAccess"
            )
        ).withDelay(Duration.ofSeconds(1)));
        sources.add(SourceDescriptor.of(
            "Bluesky search",
            new BlueskySearchFetcher(httpClient, objectMapper, endpoints.getBlueskySearchUrl(), "Sora invite code")
        ).withDelay(Duration.ofSeconds(2)));
        sources.add(SourceDescriptor.of(
            "GitHub issues",
            new GitHubIssuesFetcher(
                httpClient,
                objectMapper,
                endpoints.getGithubSearchUrl(),
                "Sora invite code OR Sora access code"
            )
        ).withDelay(Duration.ofSeconds(3)));
        sources.add(SourceDescriptor.of(
            "Mastodon search",
            new MastodonSearchFetcher(httpClient, objectMapper, endpoints.getMastodonSearchUrl(), "Sora invite")
        ).withDelay(Duration.ofSeconds(2)));
        sources.add(SourceDescriptor.of(
            "Hacker News",
            new HackerNewsFetcher(httpClient, objectMapper, endpoints.getHackerNewsSearchUrl())
        ));
        sources.add(SourceDescriptor.of(
            "OpenAI Community",
            new DiscourseLatestFetcher(httpClient, objectMapper, endpoints.getOpenaiForumBaseUrl())
        ));

        List<SourceDescriptor> resolved = new ArrayList<>(sources.size());
        for (SourceDescriptor source : sources) {
            resolved.add(source.withEnabled(!properties.getSources().isDisabled(source.name())));
        }
        return resolved;
    }
}
