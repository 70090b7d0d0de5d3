package com.invitehunter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "hunter")
public class HunterProperties {
    public static final String DEFAULT_QUERY = "Sora invite code OR 'Sora 2 invite' OR 'Sora2 invite'";
    public static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/131.0.0.0 Safari/537.36 "
            + "(SoraInviteHunter/2.0; +https://github.com/Sora-invite-hunter)";
    public static final int MIN_POLL_INTERVAL_SECONDS = 10;
    public static final int MAX_POSTS_UPPER_BOUND = 100;

    private String query;
    private String userAgent;
    private String githubToken;
    private String brandTerm = "sora";
    private int pollIntervalSeconds = 60;
    private int maxPostsPerSource = 75;
    private int maxCandidates = 1000;
    private int maxLogEntries = 500;
    private int minimumSleepSeconds = 5;
    private int requestTimeoutSeconds = 30;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 1000;
    private int requestRetryMaxDelayMs = 8000;
    private Poller poller = new Poller();
    private Sources sources = new Sources();
    private Endpoints endpoints = new Endpoints();

    public String getQuery() {
        return normalizeQuery(query);
    }

    public void setQuery(String query) {
        this.query = normalizeQuery(query);
    }

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public String getGithubToken() {
        return githubToken == null ? "" : githubToken.trim();
    }

    public void setGithubToken(String githubToken) {
        this.githubToken = githubToken;
    }

    public String getBrandTerm() {
        return brandTerm == null || brandTerm.isBlank() ? "sora" : brandTerm.trim();
    }

    public void setBrandTerm(String brandTerm) {
        this.brandTerm = brandTerm;
    }

    public int getPollIntervalSeconds() {
        return Math.max(MIN_POLL_INTERVAL_SECONDS, pollIntervalSeconds);
    }

    public void setPollIntervalSeconds(int pollIntervalSeconds) {
        this.pollIntervalSeconds = pollIntervalSeconds;
    }

    public int getMaxPostsPerSource() {
        return Math.max(1, Math.min(maxPostsPerSource, MAX_POSTS_UPPER_BOUND));
    }

    public void setMaxPostsPerSource(int maxPostsPerSource) {
        this.maxPostsPerSource = maxPostsPerSource;
    }

    public int getMaxCandidates() {
        return Math.max(1, maxCandidates);
    }

    public void setMaxCandidates(int maxCandidates) {
        this.maxCandidates = maxCandidates;
    }

    public int getMaxLogEntries() {
        return Math.max(1, maxLogEntries);
    }

    public void setMaxLogEntries(int maxLogEntries) {
        this.maxLogEntries = maxLogEntries;
    }

    public int getMinimumSleepSeconds() {
        return Math.max(1, minimumSleepSeconds);
    }

    public void setMinimumSleepSeconds(int minimumSleepSeconds) {
        this.minimumSleepSeconds = minimumSleepSeconds;
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = requestMaxRetries;
    }

    public int getRequestRetryBaseDelayMs() {
        return requestRetryBaseDelayMs;
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return requestRetryMaxDelayMs;
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public Poller getPoller() {
        return poller;
    }

    public void setPoller(Poller poller) {
        this.poller = poller;
    }

    public Sources getSources() {
        return sources;
    }

    public void setSources(Sources sources) {
        this.sources = sources;
    }

    public Endpoints getEndpoints() {
        return endpoints;
    }

    public void setEndpoints(Endpoints endpoints) {
        this.endpoints = endpoints;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static String normalizeQuery(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_QUERY;
        }
        return candidate.trim();
    }

    public static class Poller {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Sources {
        private List<String> disabled = new ArrayList<>();

        public List<String> getDisabled() {
            return disabled;
        }

        public void setDisabled(List<String> disabled) {
            this.disabled = disabled == null ? new ArrayList<>() : disabled;
        }

        public boolean isDisabled(String sourceName) {
            return disabled.stream().anyMatch(name -> name != null && name.trim().equalsIgnoreCase(sourceName));
        }
    }

    public static class Endpoints {
        private String redditBaseUrl = "https://www.reddit.com";
        private String hackerNewsSearchUrl = "https://hn.algolia.com/api/v1/search_by_date";
        private String openaiForumBaseUrl = "https://community.openai.com";
        private String githubSearchUrl = "https://api.github.com/search/issues";
        private String mastodonSearchUrl = "https://mastodon.social/api/v2/search";
        private String blueskySearchUrl = "https://public.api.bsky.app/xrpc/app.bsky.feed.searchPosts";
        private String searchProxyPrefix = "https://r.jina.ai/";

        public String getRedditBaseUrl() {
            return redditBaseUrl;
        }

        public void setRedditBaseUrl(String redditBaseUrl) {
            this.redditBaseUrl = redditBaseUrl;
        }

        public String getHackerNewsSearchUrl() {
            return hackerNewsSearchUrl;
        }

        public void setHackerNewsSearchUrl(String hackerNewsSearchUrl) {
            this.hackerNewsSearchUrl = hackerNewsSearchUrl;
        }

        public String getOpenaiForumBaseUrl() {
            return openaiForumBaseUrl;
        }

        public void setOpenaiForumBaseUrl(String openaiForumBaseUrl) {
            this.openaiForumBaseUrl = openaiForumBaseUrl;
        }

        public String getGithubSearchUrl() {
            return githubSearchUrl;
        }

        public void setGithubSearchUrl(String githubSearchUrl) {
            this.githubSearchUrl = githubSearchUrl;
        }

        public String getMastodonSearchUrl() {
            return mastodonSearchUrl;
        }

        public void setMastodonSearchUrl(String mastodonSearchUrl) {
            this.mastodonSearchUrl = mastodonSearchUrl;
        }

        public String getBlueskySearchUrl() {
            return blueskySearchUrl;
        }

        public void setBlueskySearchUrl(String blueskySearchUrl) {
            this.blueskySearchUrl = blueskySearchUrl;
        }

        public String getSearchProxyPrefix() {
            return searchProxyPrefix;
        }

        public void setSearchProxyPrefix(String searchProxyPrefix) {
            this.searchProxyPrefix = searchProxyPrefix;
        }
    }
}
