package com.invitehunter.hunt.model;

import java.time.Instant;

/**
 * Last known outcome of one registered source. A success after the last error
 * marks the source healthy again while the error timestamp stays as history.
 */
public record SourceHealth(
    String name,
    boolean enabled,
    Instant lastSuccess,
    Instant lastError,
    String lastErrorMessage
) {
    public boolean isHealthy() {
        if (lastSuccess == null) {
            return false;
        }
        return lastError == null || !lastSuccess.isBefore(lastError);
    }

    public SourceHealth withSuccess(Instant at) {
        return new SourceHealth(name, enabled, at, lastError, lastErrorMessage);
    }

    public SourceHealth withFailure(Instant at, String message) {
        return new SourceHealth(name, enabled, lastSuccess, at, message);
    }
}
