package com.invitehunter.hunt.model;

public record PollerStatusResponse(
    boolean running,
    long cyclesCompleted,
    CycleSummary lastCycle
) {
}
