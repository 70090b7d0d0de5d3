package com.invitehunter.hunt.model;

import java.time.Instant;

public record Candidate(
    String code,
    String exampleText,
    String sourceTitle,
    String url,
    Instant discoveredAt,
    double confidence,
    String sourceType
) {
}
