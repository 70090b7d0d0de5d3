package com.invitehunter.hunt.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.invitehunter.config.HunterProperties;
import com.invitehunter.hunt.http.PoliteHttpClient;
import com.invitehunter.hunt.model.PollSettings;
import com.invitehunter.hunt.model.SourcePost;
import com.invitehunter.hunt.util.ReasonCodeClassifier;
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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedditFetcherTest {
    private static final String LISTING = """
        {"data": {"children": [
          {"data": {"title": "Sora invite", "selftext": "code SORA2X9", "permalink": "/r/OpenAI/comments/abc/x/",
                    "url": "https://i.redd.it/x.png"}},
          {"data": {"title": "link only", "url": "https://example.com/a"}},
          {"kind": "more"}
        ]}}
        """;

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
    void searchUsesCycleQueryAndMapsPermalinks() throws Exception {
        server.enqueue(new MockResponse().setBody(LISTING).setHeader("Content-Type", "application/json"));
        String base = baseUrl();
        RedditSearchFetcher fetcher = new RedditSearchFetcher(httpClient, objectMapper, base + "/", null, "day");

        List<SourcePost> posts = fetcher.fetch(settings(75));

        assertThat(posts).hasSize(2);
        assertThat(posts.get(0).title()).isEqualTo("Sora invite");
        assertThat(posts.get(0).body()).isEqualTo("code SORA2X9");
        assertThat(posts.get(0).url()).isEqualTo(base + "/r/OpenAI/comments/abc/x/");
        assertThat(posts.get(1).url()).isEqualTo("https://example.com/a");
        assertThat(posts.get(1).body()).isEmpty();

        RecordedRequest request = server.takeRequest();
        HttpUrl url = request.getRequestUrl();
        assertThat(url.encodedPath()).isEqualTo("/search.json");
        assertThat(url.queryParameter("q")).isEqualTo("Sora invite code");
        assertThat(url.queryParameter("sort")).isEqualTo("new");
        assertThat(url.queryParameter("limit")).isEqualTo("75");
        assertThat(url.queryParameter("restrict_sr")).isEqualTo("false");
        assertThat(url.queryParameter("t")).isEqualTo("day");
        assertThat(request.getHeader("Accept")).startsWith("application/json");
    }

    @Test
    void fixedQuerySearchIgnoresCycleQuery() throws Exception {
        server.enqueue(new MockResponse().setBody(LISTING));
        RedditSearchFetcher fetcher = new RedditSearchFetcher(httpClient, objectMapper, baseUrl(), "Sora beta access", "week");

        fetcher.fetch(settings(75));

        HttpUrl url = server.takeRequest().getRequestUrl();
        assertThat(url.queryParameter("q")).isEqualTo("Sora beta access");
        assertThat(url.queryParameter("t")).isEqualTo("week");
    }

    @Test
    void subredditListingHonoursPostLimit() throws Exception {
        server.enqueue(new MockResponse().setBody(LISTING));
        RedditSubredditFetcher fetcher = new RedditSubredditFetcher(httpClient, objectMapper, baseUrl(), "OpenAI");

        List<SourcePost> posts = fetcher.fetch(settings(1));

        assertThat(posts).hasSize(1);
        HttpUrl url = server.takeRequest().getRequestUrl();
        assertThat(url.encodedPath()).isEqualTo("/r/OpenAI/new.json");
        assertThat(url.queryParameter("limit")).isEqualTo("1");
    }

    @Test
    void unexpectedShapeYieldsNoPosts() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"error\": \"gone\"}"));
        RedditSubredditFetcher fetcher = new RedditSubredditFetcher(httpClient, objectMapper, baseUrl(), "SoraAI");

        assertThat(fetcher.fetch(settings(75))).isEmpty();
    }

    @Test
    void malformedJsonIsAFetchFailure() {
        server.enqueue(new MockResponse().setBody("<html>blocked</html>"));
        RedditSubredditFetcher fetcher = new RedditSubredditFetcher(httpClient, objectMapper, baseUrl(), "ChatGPT");

        assertThatThrownBy(() -> fetcher.fetch(settings(75)))
            .isInstanceOf(SourceFetchException.class)
            .hasMessageContaining("malformed JSON")
            .extracting(e -> ((SourceFetchException) e).getReasonCode())
            .isEqualTo(ReasonCodeClassifier.PARSING_FAILED);
    }

    @Test
    void httpErrorIsAFetchFailure() {
        server.enqueue(new MockResponse().setResponseCode(503));
        RedditSubredditFetcher fetcher = new RedditSubredditFetcher(httpClient, objectMapper, baseUrl(), "artificial");

        assertThatThrownBy(() -> fetcher.fetch(settings(75)))
            .isInstanceOf(SourceFetchException.class)
            .hasMessageContaining("HTTP 503")
            .extracting(e -> ((SourceFetchException) e).getReasonCode())
            .isEqualTo(ReasonCodeClassifier.HTTP_5XX);
    }

    @Test
    void subredditIsRequired() {
        assertThatThrownBy(() -> new RedditSubredditFetcher(httpClient, objectMapper, baseUrl(), " "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private String baseUrl() {
        return RedditListingFetcher.trimTrailingSlash(server.url("/").toString());
    }

    private static PollSettings settings(int maxPosts) {
        return new PollSettings(60, maxPosts, "Sora invite code", "test-agent", "");
    }
}
