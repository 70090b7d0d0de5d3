package com.invitehunter.hunt.model;

import java.time.Instant;

public record ActivityLogEntry(Instant timestamp, LogLevel level, String message) {}
