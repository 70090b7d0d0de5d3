package com.invitehunter.hunt.extract;

import java.util.List;
import java.util.Locale;

public class ConfidenceScorer {
    static final double BASE_SCORE = 0.5;
    static final double KEYWORD_BONUS = 0.1;
    static final double KEYWORD_BONUS_CAP = 0.3;
    static final double BRAND_BONUS = 0.15;
    static final double NOISE_PENALTY = 0.3;
    static final double MIN_SCORE = 0.1;
    static final double MAX_SCORE = 1.0;

    public static final List<String> INVITE_KEYWORDS = List.of(
        "invite",
        "code",
        "beta",
        "access",
        "key",
        "token",
        "giveaway",
        "sharing",
        "redeem",
        "signup"
    );
    private static final List<String> NOISE_TERMS = List.of("error", "exception", "stack", "debug");

    private final String brandTerm;

    public ConfidenceScorer(String brandTerm) {
        this.brandTerm = brandTerm == null ? "" : brandTerm.trim().toLowerCase(Locale.ROOT);
    }

    public double score(String text, String token) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        double score = BASE_SCORE;

        long keywordCount = INVITE_KEYWORDS.stream().filter(lower::contains).count();
        score += Math.min(keywordCount * KEYWORD_BONUS, KEYWORD_BONUS_CAP);

        if (!brandTerm.isEmpty() && lower.contains(brandTerm)) {
            score += BRAND_BONUS;
        }
        if (NOISE_TERMS.stream().anyMatch(lower::contains)) {
            score -= NOISE_PENALTY;
        }
        return Math.min(Math.max(score, MIN_SCORE), MAX_SCORE);
    }

    public String getBrandTerm() {
        return brandTerm;
    }
}
