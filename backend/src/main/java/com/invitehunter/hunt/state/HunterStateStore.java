package com.invitehunter.hunt.state;

import com.invitehunter.hunt.model.ActivityLogEntry;
import com.invitehunter.hunt.model.Candidate;
import com.invitehunter.hunt.model.HuntSnapshot;
import com.invitehunter.hunt.model.LogLevel;
import com.invitehunter.hunt.model.SourceHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Process-wide hunt state: the candidate ring buffer, the set of every token ever
 * seen, the activity log ring buffer, per-source health and counters.
 *
 * <p>Every operation takes the same monitor for the duration of a single logical
 * step. Only the poller thread mutates; readers call {@link #snapshot()}.
 */
public class HunterStateStore {
    private static final Logger log = LoggerFactory.getLogger(HunterStateStore.class);

    private final Object lock = new Object();
    private final int candidateCapacity;
    private final int logCapacity;
    private final ArrayDeque<Candidate> candidates;
    private final ArrayDeque<ActivityLogEntry> activityLog;
    private final Set<String> seenCodes = new HashSet<>();
    private final Map<String, SourceHealth> sourceHealth = new LinkedHashMap<>();

    private long successCount;
    private long errorCount;
    private Instant lastPoll;

    public HunterStateStore(int candidateCapacity, int logCapacity) {
        if (candidateCapacity < 1 || logCapacity < 1) {
            throw new IllegalArgumentException("capacities must be positive");
        }
        this.candidateCapacity = candidateCapacity;
        this.logCapacity = logCapacity;
        this.candidates = new ArrayDeque<>(Math.min(candidateCapacity, 1024));
        this.activityLog = new ArrayDeque<>(Math.min(logCapacity, 1024));
    }

    public boolean isSeen(String token) {
        synchronized (lock) {
            return seenCodes.contains(token);
        }
    }

    public void markSeen(String token) {
        synchronized (lock) {
            seenCodes.add(token);
        }
    }

    /**
     * Check-then-set in one critical section.
     *
     * @return true when the token was not seen before and is now recorded
     */
    public boolean markSeenIfAbsent(String token) {
        synchronized (lock) {
            return seenCodes.add(token);
        }
    }

    public void appendCandidate(Candidate candidate) {
        synchronized (lock) {
            if (candidates.size() >= candidateCapacity) {
                candidates.pollFirst();
            }
            candidates.addLast(candidate);
        }
    }

    public ActivityLogEntry appendLog(LogLevel level, String message) {
        ActivityLogEntry entry = new ActivityLogEntry(Instant.now(), level, message);
        synchronized (lock) {
            if (activityLog.size() >= logCapacity) {
                activityLog.pollFirst();
            }
            activityLog.addLast(entry);
        }
        mirror(entry);
        return entry;
    }

    public void registerSource(String sourceName, boolean enabled) {
        synchronized (lock) {
            sourceHealth.putIfAbsent(sourceName, new SourceHealth(sourceName, enabled, null, null, null));
        }
    }

    public void recordSuccess(String sourceName, Instant at) {
        synchronized (lock) {
            SourceHealth current = sourceHealth.get(sourceName);
            if (current == null) {
                current = new SourceHealth(sourceName, true, null, null, null);
            }
            sourceHealth.put(sourceName, current.withSuccess(at));
            successCount++;
        }
    }

    public void recordFailure(String sourceName, Instant at, String message) {
        synchronized (lock) {
            SourceHealth current = sourceHealth.get(sourceName);
            if (current == null) {
                current = new SourceHealth(sourceName, true, null, null, null);
            }
            sourceHealth.put(sourceName, current.withFailure(at, message));
            errorCount++;
        }
    }

    public void markPolled(Instant at) {
        synchronized (lock) {
            lastPoll = at;
        }
    }

    public HuntSnapshot snapshot() {
        synchronized (lock) {
            return new HuntSnapshot(
                newestFirst(candidates),
                newestFirst(activityLog),
                candidates.size(),
                seenCodes.size(),
                successCount,
                errorCount,
                List.copyOf(sourceHealth.values()),
                lastPoll
            );
        }
    }

    public int getCandidateCapacity() {
        return candidateCapacity;
    }

    public int getLogCapacity() {
        return logCapacity;
    }

    private static <T> List<T> newestFirst(ArrayDeque<T> deque) {
        List<T> copy = new ArrayList<>(deque.size());
        Iterator<T> iterator = deque.descendingIterator();
        while (iterator.hasNext()) {
            copy.add(iterator.next());
        }
        return Collections.unmodifiableList(copy);
    }

    private void mirror(ActivityLogEntry entry) {
        switch (entry.level()) {
            case ERROR -> log.error("{}", entry.message());
            case DEBUG -> log.debug("{}", entry.message());
            default -> log.info("{}", entry.message());
        }
    }
}
