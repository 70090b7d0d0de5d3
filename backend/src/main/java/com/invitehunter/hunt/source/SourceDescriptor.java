package com.invitehunter.hunt.source;

import java.time.Duration;
import java.util.Locale;

public record SourceDescriptor(
    String name,
    boolean enabled,
    Duration rateLimitDelay,
    SourceFetcher fetcher
) {
    public SourceDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("source name is required");
        }
        if (fetcher == null) {
            throw new IllegalArgumentException("fetcher is required for " + name);
        }
        rateLimitDelay = rateLimitDelay == null || rateLimitDelay.isNegative() ? Duration.ZERO : rateLimitDelay;
    }

    public static SourceDescriptor of(String name, SourceFetcher fetcher) {
        return new SourceDescriptor(name, true, Duration.ZERO, fetcher);
    }

    public SourceDescriptor withDelay(Duration delay) {
        return new SourceDescriptor(name, enabled, delay, fetcher);
    }

    public SourceDescriptor withEnabled(boolean value) {
        return new SourceDescriptor(name, value, rateLimitDelay, fetcher);
    }

    public String sourceType() {
        return sourceTypeOf(name);
    }

    public static String sourceTypeOf(String sourceName) {
        if (sourceName == null || sourceName.isBlank()) {
            return "unknown";
        }
        return sourceName.trim().split("\\s+")[0].toLowerCase(Locale.ROOT);
    }
}
