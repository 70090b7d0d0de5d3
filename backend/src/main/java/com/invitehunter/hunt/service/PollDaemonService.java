package com.invitehunter.hunt.service;

import com.invitehunter.config.HunterProperties;
import com.invitehunter.hunt.model.CycleSummary;
import com.invitehunter.hunt.model.LogLevel;
import com.invitehunter.hunt.model.PollSettings;
import com.invitehunter.hunt.model.PollerStatusResponse;
import com.invitehunter.hunt.state.HunterStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the single background poller thread. Each pass reads fresh settings, runs
 * one cycle and then rests for whatever is left of the poll interval, never less
 * than the configured minimum.
 */
@Service
public class PollDaemonService {
    private static final Logger log = LoggerFactory.getLogger(PollDaemonService.class);

    private final PollOrchestratorService orchestrator;
    private final PollSettingsProvider settingsProvider;
    private final HunterStateStore stateStore;
    private final HunterProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong cyclesCompleted = new AtomicLong();
    private final AtomicReference<CycleSummary> lastCycle = new AtomicReference<>();
    private final Object lifecycleLock = new Object();

    private ExecutorService executor;

    public PollDaemonService(
        PollOrchestratorService orchestrator,
        PollSettingsProvider settingsProvider,
        HunterStateStore stateStore,
        HunterProperties properties
    ) {
        this.orchestrator = orchestrator;
        this.settingsProvider = settingsProvider;
        this.stateStore = stateStore;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getPoller().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
        }
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            executor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("source-poller");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            executor.submit(this::pollLoop);
            log.info("Background polling thread started");
            stateStore.appendLog(LogLevel.INFO, "System initialized");
        }
    }

    public PollerStatusResponse getStatus() {
        return new PollerStatusResponse(running.get(), cyclesCompleted.get(), lastCycle.get());
    }

    private void pollLoop() {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            Instant startedAt = Instant.now();
            PollSettings settings = settingsProvider.current();
            try {
                CycleSummary summary = orchestrator.runCycle(settings);
                lastCycle.set(summary);
                cyclesCompleted.incrementAndGet();
            } catch (RuntimeException e) {
                log.error("Poll cycle failed unexpectedly", e);
            }
            Duration elapsed = Duration.between(startedAt, Instant.now());
            Duration rest = restDuration(
                Duration.ofSeconds(settings.pollIntervalSeconds()),
                elapsed,
                Duration.ofSeconds(properties.getMinimumSleepSeconds())
            );
            try {
                TimeUnit.MILLISECONDS.sleep(rest.toMillis());
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
            }
        }
    }

    static Duration restDuration(Duration interval, Duration elapsed, Duration minimum) {
        Duration remaining = interval.minus(elapsed);
        return remaining.compareTo(minimum) < 0 ? minimum : remaining;
    }
}
