package com.invitehunter.hunt.service;

import com.invitehunter.hunt.model.ActivityLogEntry;
import com.invitehunter.hunt.model.Candidate;
import com.invitehunter.hunt.model.CodesResponse;
import com.invitehunter.hunt.model.SourceHealth;
import com.invitehunter.hunt.state.HunterStateStore;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@Service
public class HuntStatusService {
    private final HunterStateStore stateStore;
    private final PollSettingsProvider settingsProvider;

    public HuntStatusService(HunterStateStore stateStore, PollSettingsProvider settingsProvider) {
        this.stateStore = stateStore;
        this.settingsProvider = settingsProvider;
    }

    public CodesResponse getCodes() {
        return CodesResponse.of(settingsProvider.current(), stateStore.snapshot());
    }

    public List<Candidate> getNewestCandidates(Integer limit, Double minConfidence) {
        int safeLimit = limit == null ? 100 : Math.max(1, Math.min(limit, stateStore.getCandidateCapacity()));
        if (minConfidence != null && (minConfidence.isNaN() || minConfidence < 0.0 || minConfidence > 1.0)) {
            throw new ResponseStatusException(BAD_REQUEST, "minConfidence must be between 0 and 1");
        }
        double threshold = minConfidence == null ? 0.0 : minConfidence;
        return stateStore.snapshot().candidates().stream()
            .filter(candidate -> candidate.confidence() >= threshold)
            .limit(safeLimit)
            .toList();
    }

    public List<ActivityLogEntry> getRecentActivity(Integer limit) {
        int safeLimit = limit == null ? 100 : Math.max(1, Math.min(limit, stateStore.getLogCapacity()));
        return stateStore.snapshot().activityLog().stream()
            .limit(safeLimit)
            .toList();
    }

    public List<SourceHealth> getSources() {
        return stateStore.snapshot().sources();
    }
}
