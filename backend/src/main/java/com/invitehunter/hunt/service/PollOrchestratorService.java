package com.invitehunter.hunt.service;

import com.invitehunter.hunt.model.Candidate;
import com.invitehunter.hunt.model.CycleSummary;
import com.invitehunter.hunt.model.LogLevel;
import com.invitehunter.hunt.model.PollSettings;
import com.invitehunter.hunt.model.SourcePost;
import com.invitehunter.hunt.source.SourceDescriptor;
import com.invitehunter.hunt.source.SourceFetchException;
import com.invitehunter.hunt.source.SourceRegistry;
import com.invitehunter.hunt.state.HunterStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
public class PollOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(PollOrchestratorService.class);
    private static final int MAX_ERROR_LENGTH = 500;

    private final SourceRegistry registry;
    private final CandidatePipeline pipeline;
    private final HunterStateStore stateStore;

    public PollOrchestratorService(SourceRegistry registry, CandidatePipeline pipeline, HunterStateStore stateStore) {
        this.registry = registry;
        this.pipeline = pipeline;
        this.stateStore = stateStore;
    }

    /**
     * Polls every enabled source once, in registration order. A failing source is
     * logged and recorded, then the cycle moves on to the next one.
     */
    public CycleSummary runCycle(PollSettings settings) {
        Instant startedAt = Instant.now();
        List<SourceDescriptor> sources = registry.getEnabled();
        stateStore.appendLog(LogLevel.INFO, "Starting poll cycle (" + sources.size() + " sources)");

        int newCandidates = 0;
        int failed = 0;
        for (SourceDescriptor source : sources) {
            List<SourcePost> posts;
            try {
                posts = source.fetcher().fetch(settings);
                if (posts == null) {
                    posts = List.of();
                }
            } catch (SourceFetchException e) {
                recordFailure(source, e.getMessage());
                failed++;
                continue;
            } catch (RuntimeException e) {
                log.warn("Unexpected failure while polling {}", source.name(), e);
                recordFailure(source, e.getClass().getSimpleName() + ": " + e.getMessage());
                failed++;
                continue;
            }

            List<Candidate> created = new ArrayList<>();
            try {
                pipeline.process(posts, source.name(), created);
            } catch (RuntimeException e) {
                // candidates appended before the failure are already in the store
                newCandidates += created.size();
                log.warn("Processing failed for {} after {} new candidate(s)", source.name(), created.size(), e);
                recordFailure(source, e.getClass().getSimpleName() + ": " + e.getMessage());
                failed++;
                continue;
            }

            newCandidates += created.size();
            stateStore.recordSuccess(source.name(), Instant.now());
            stateStore.appendLog(
                LogLevel.DEBUG,
                source.name() + ": " + posts.size() + " item(s), " + created.size() + " new"
            );
            // Rate limiting only follows a successful fetch.
            if (!source.rateLimitDelay().isZero()) {
                pause(source.rateLimitDelay());
            }
        }

        if (newCandidates > 0) {
            stateStore.appendLog(LogLevel.SUCCESS, "Discovered " + newCandidates + " new candidates");
        } else {
            stateStore.appendLog(LogLevel.INFO, "No new candidates this cycle");
        }
        Instant finishedAt = Instant.now();
        stateStore.markPolled(finishedAt);
        return new CycleSummary(
            startedAt,
            sources.size(),
            failed,
            newCandidates,
            Duration.between(startedAt, finishedAt)
        );
    }

    protected void pause(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void recordFailure(SourceDescriptor source, String reason) {
        String message = source.name() + ": " + (reason == null ? "unknown error" : reason);
        if (message.length() > MAX_ERROR_LENGTH) {
            message = message.substring(0, MAX_ERROR_LENGTH);
        }
        stateStore.appendLog(LogLevel.ERROR, message);
        stateStore.recordFailure(source.name(), Instant.now(), message);
    }
}
