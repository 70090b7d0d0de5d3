package com.invitehunter.hunt.model;

import java.time.Duration;
import java.time.Instant;

public record CycleSummary(
    Instant startedAt,
    int sourcesPolled,
    int sourcesFailed,
    int newCandidates,
    Duration elapsed
) {
}
