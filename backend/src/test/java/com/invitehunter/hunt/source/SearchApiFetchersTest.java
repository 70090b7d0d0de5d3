package com.invitehunter.hunt.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.invitehunter.config.HunterProperties;
import com.invitehunter.hunt.http.PoliteHttpClient;
import com.invitehunter.hunt.model.PollSettings;
import com.invitehunter.hunt.model.SourcePost;
import okhttp3.HttpUrl;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class SearchApiFetchersTest {
    private static final PollSettings SETTINGS = new PollSettings(60, 75, "Sora invite code", "test-agent", "");

    private MockWebServer server;
    private ExecutorService executor;
    private PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        HunterProperties properties = new HunterProperties();
        properties.setRequestMaxRetries(0);
        properties.setRequestTimeoutSeconds(5);
        executor = Executors.newFixedThreadPool(1);
        httpClient = new PoliteHttpClient(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void blueskyBuildsProfileLinksAndCapsLimit() throws Exception {
        server.enqueue(new MockResponse().setBody("""
            {"posts": [{"uri": "at://did:plc:abc/app.bsky.feed.post/3kxyz",
                        "author": {"handle": "alice.bsky.social"},
                        "record": {"text": "invite SORA2X9"}},
                       {"record": {"text": "anonymous"}}]}
            """));
        BlueskySearchFetcher fetcher = new BlueskySearchFetcher(httpClient, objectMapper, url("/xrpc/search"), "Sora invite code");

        List<SourcePost> posts = fetcher.fetch(SETTINGS);

        assertThat(posts).containsExactly(
            new SourcePost(
                "Bluesky post by @alice.bsky.social",
                "invite SORA2X9",
                "https://bsky.app/profile/alice.bsky.social/post/3kxyz"
            ),
            new SourcePost("Bluesky post by @unknown", "anonymous", "")
        );
        HttpUrl requested = server.takeRequest().getRequestUrl();
        assertThat(requested.queryParameter("q")).isEqualTo("Sora invite code");
        assertThat(requested.queryParameter("limit")).isEqualTo(String.valueOf(BlueskySearchFetcher.MAX_LIMIT));
    }

    @Test
    void githubSendsTokenWhenConfigured() throws Exception {
        server.enqueue(new MockResponse().setBody("""
            {"items": [{"title": "Invites", "body": "SORA2X9", "html_url": "https://github.com/o/r/issues/1"}]}
            """));
        GitHubIssuesFetcher fetcher = new GitHubIssuesFetcher(httpClient, objectMapper, url("/search/issues"), "Sora invite code");

        List<SourcePost> posts = fetcher.fetch(new PollSettings(60, 75, "q", "test-agent", "secret"));

        assertThat(posts).containsExactly(new SourcePost("GitHub: Invites", "SORA2X9", "https://github.com/o/r/issues/1"));
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("Authorization")).isEqualTo("token secret");
        assertThat(request.getHeader("Accept")).isEqualTo("application/vnd.github+json");
        assertThat(request.getRequestUrl().queryParameter("q")).isEqualTo("Sora invite code");
        assertThat(request.getRequestUrl().queryParameter("per_page")).isEqualTo("30");
        assertThat(request.getRequestUrl().queryParameter("sort")).isEqualTo("created");
    }

    @Test
    void githubOmitsAuthorizationWithoutToken() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"items\": []}"));
        GitHubIssuesFetcher fetcher = new GitHubIssuesFetcher(httpClient, objectMapper, url("/search/issues"), "Sora invite code");

        assertThat(fetcher.fetch(SETTINGS)).isEmpty();
        assertThat(server.takeRequest().getHeader("Authorization")).isNull();
    }

    @Test
    void mastodonStripsHtmlFromStatuses() throws Exception {
        server.enqueue(new MockResponse().setBody("""
            {"statuses": [{"content": "<p>Invite <b>SORA2X9</b> &amp; more</p>",
                           "url": "https://mastodon.social/@bob/1",
                           "account": {"acct": "bob"}}]}
            """));
        MastodonSearchFetcher fetcher = new MastodonSearchFetcher(httpClient, objectMapper, url("/api/v2/search"), "Sora invite");

        List<SourcePost> posts = fetcher.fetch(SETTINGS);

        assertThat(posts).containsExactly(
            new SourcePost("Mastodon post by @bob", "Invite SORA2X9 & more", "https://mastodon.social/@bob/1")
        );
        HttpUrl requested = server.takeRequest().getRequestUrl();
        assertThat(requested.queryParameter("type")).isEqualTo("statuses");
        assertThat(requested.queryParameter("limit")).isEqualTo("20");
    }

    @Test
    void hackerNewsFallsBackToStoryFieldsAndItemLinks() throws Exception {
        server.enqueue(new MockResponse().setBody("""
            {"hits": [
              {"title": null, "story_title": "Sora thread", "comment_text": "code ABC123", "objectID": "42"},
              {"title": "Show HN", "url": "https://example.com/show", "story_text": "SORA2X9", "objectID": "43"}
            ]}
            """));
        HackerNewsFetcher fetcher = new HackerNewsFetcher(httpClient, objectMapper, url("/api/v1/search_by_date"));

        List<SourcePost> posts = fetcher.fetch(SETTINGS);

        assertThat(posts).containsExactly(
            new SourcePost("Sora thread", "code ABC123", "https://news.ycombinator.com/item?id=42"),
            new SourcePost("Show HN", "SORA2X9", "https://example.com/show")
        );
        HttpUrl requested = server.takeRequest().getRequestUrl();
        assertThat(requested.queryParameter("query")).isEqualTo("Sora invite code");
        assertThat(requested.queryParameter("tags")).isEqualTo("(story,comment)");
        assertThat(requested.queryParameter("hitsPerPage")).isEqualTo("50");
    }

    @Test
    void discourseBuildsTopicLinks() throws Exception {
        server.enqueue(new MockResponse().setBody("""
            {"topic_list": {"topics": [{"id": 7, "slug": "sora-codes", "title": "Sora codes", "excerpt": "try ABC123"}]}}
            """));
        String base = url("/");
        DiscourseLatestFetcher fetcher = new DiscourseLatestFetcher(httpClient, objectMapper, base);

        List<SourcePost> posts = fetcher.fetch(SETTINGS);

        String trimmed = base.substring(0, base.length() - 1);
        assertThat(posts).containsExactly(new SourcePost("Sora codes", "try ABC123", trimmed + "/t/sora-codes/7"));
        assertThat(server.takeRequest().getPath()).isEqualTo("/latest.json");
    }

    @Test
    void xLiveSearchReturnsWholePageTruncated() throws Exception {
        server.enqueue(new MockResponse().setBody("A".repeat(20000)));
        String searchUrl = "https://x.com/search?q=%23SoraInvite&f=live";
        XLiveSearchFetcher fetcher = new XLiveSearchFetcher(httpClient, objectMapper, url("/"), searchUrl, "Live tweets: #SoraInvite");

        List<SourcePost> posts = fetcher.fetch(SETTINGS);

        assertThat(posts).hasSize(1);
        assertThat(posts.get(0).title()).isEqualTo("Live tweets: #SoraInvite");
        assertThat(posts.get(0).url()).isEqualTo(searchUrl);
        assertThat(posts.get(0).body()).hasSize(XLiveSearchFetcher.MAX_BODY_CHARS);
        assertThat(server.takeRequest().getPath()).startsWith("/https://x.com/search");
    }

    private String url(String path) {
        return server.url(path).toString();
    }
}
