package com.invitehunter.hunt.model;

import com.invitehunter.config.HunterProperties;

public record PollSettings(
    int pollIntervalSeconds,
    int maxPostsPerSource,
    String query,
    String userAgent,
    String githubToken
) {
    public static PollSettings from(HunterProperties properties) {
        return new PollSettings(
            properties.getPollIntervalSeconds(),
            properties.getMaxPostsPerSource(),
            properties.getQuery(),
            properties.getUserAgent(),
            properties.getGithubToken()
        );
    }

    public boolean hasGithubToken() {
        return githubToken != null && !githubToken.isBlank();
    }
}
