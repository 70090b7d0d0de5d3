package com.invitehunter.hunt.model;

import java.time.Instant;
import java.util.List;

public record CodesResponse(
    String query,
    int pollIntervalSeconds,
    int maxPosts,
    Instant lastPoll,
    int totalCandidates,
    int uniqueCodes,
    long successCount,
    long errorCount,
    List<Candidate> candidates,
    List<ActivityLogEntry> activityLog,
    List<SourceHealth> sources
) {
    public static CodesResponse of(PollSettings settings, HuntSnapshot snapshot) {
        return new CodesResponse(
            settings.query(),
            settings.pollIntervalSeconds(),
            settings.maxPostsPerSource(),
            snapshot.lastPoll(),
            snapshot.totalCandidates(),
            snapshot.uniqueCodes(),
            snapshot.successCount(),
            snapshot.errorCount(),
            snapshot.candidates(),
            snapshot.activityLog(),
            snapshot.sources()
        );
    }
}
