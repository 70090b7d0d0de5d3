package com.invitehunter.hunt.model;

import java.time.Instant;
import java.util.List;

public record HuntSnapshot(
    List<Candidate> candidates,
    List<ActivityLogEntry> activityLog,
    int totalCandidates,
    int uniqueCodes,
    long successCount,
    long errorCount,
    List<SourceHealth> sources,
    Instant lastPoll
) {
}
