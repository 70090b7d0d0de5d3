package com.invitehunter.hunt.service;

import com.invitehunter.hunt.extract.ConfidenceScorer;
import com.invitehunter.hunt.extract.SnippetBuilder;
import com.invitehunter.hunt.extract.TokenExtractor;
import com.invitehunter.hunt.model.Candidate;
import com.invitehunter.hunt.model.LogLevel;
import com.invitehunter.hunt.model.SourcePost;
import com.invitehunter.hunt.source.SourceDescriptor;
import com.invitehunter.hunt.state.HunterStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Service
public class CandidatePipeline {
    private static final Logger log = LoggerFactory.getLogger(CandidatePipeline.class);
    private static final String UNTITLED = "Untitled";

    private final TokenExtractor extractor;
    private final ConfidenceScorer scorer;
    private final SnippetBuilder snippetBuilder;
    private final HunterStateStore stateStore;

    public CandidatePipeline(
        TokenExtractor extractor,
        ConfidenceScorer scorer,
        SnippetBuilder snippetBuilder,
        HunterStateStore stateStore
    ) {
        this.extractor = extractor;
        this.scorer = scorer;
        this.snippetBuilder = snippetBuilder;
        this.stateStore = stateStore;
    }

    public List<Candidate> process(List<SourcePost> posts, String sourceName) {
        List<Candidate> created = new ArrayList<>();
        process(posts, sourceName, created);
        return created;
    }

    /**
     * Adds each new candidate to {@code created} as soon as it is stored, so a
     * caller still sees the completed part of a batch when a later post fails.
     */
    public void process(List<SourcePost> posts, String sourceName, List<Candidate> created) {
        if (posts == null || posts.isEmpty()) {
            return;
        }
        String label = sourceName == null ? "" : sourceName.trim();
        for (SourcePost post : posts) {
            if (post == null) {
                continue;
            }
            String text = post.combinedText();
            for (String token : extractor.extract(text)) {
                if (!TokenExtractor.isAcceptable(token)) {
                    log.warn("Skipping token {} from {}: does not look like an invite code", token, label);
                    continue;
                }
                if (!stateStore.markSeenIfAbsent(token)) {
                    continue;
                }
                Candidate candidate = new Candidate(
                    token,
                    snippetBuilder.build(post.title(), post.body(), token),
                    displayTitle(post.title(), label),
                    post.url(),
                    Instant.now(),
                    scorer.score(text, token),
                    SourceDescriptor.sourceTypeOf(label)
                );
                stateStore.appendCandidate(candidate);
                created.add(candidate);
                stateStore.appendLog(
                    LogLevel.SUCCESS,
                    String.format(
                        Locale.ROOT,
                        "New candidate %s from %s (conf=%.2f)",
                        token,
                        label.isEmpty() ? "unknown source" : label,
                        candidate.confidence()
                    )
                );
            }
        }
    }

    static String displayTitle(String title, String sourceLabel) {
        String display = title == null || title.isEmpty() ? UNTITLED : title;
        if (sourceLabel != null && !sourceLabel.isEmpty() && !display.contains(sourceLabel)) {
            display = "[" + sourceLabel + "] " + display;
        }
        return display;
    }
}
