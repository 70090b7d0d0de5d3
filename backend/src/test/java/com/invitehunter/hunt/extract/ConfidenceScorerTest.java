package com.invitehunter.hunt.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceScorerTest {
    private final ConfidenceScorer scorer = new ConfidenceScorer("sora");

    @Test
    void baseScoreWithoutSignals() {
        assertThat(scorer.score("nothing to see here ABC123", "ABC123")).isCloseTo(0.5, within(1e-9));
        assertThat(scorer.score(null, "ABC123")).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void keywordsAndBrandRaiseScore() {
        double score = scorer.score("Sora invite code: SORA2X9", "SORA2X9");

        assertThat(score).isCloseTo(0.85, within(1e-9));
    }

    @Test
    void keywordBonusIsCapped() {
        double score = scorer.score("invite code beta access key token giveaway", "ABC123");

        assertThat(score).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void noiseTermsLowerScore() {
        double score = scorer.score("Exception in thread main: stack trace for invite ABC123", "ABC123");

        assertThat(score).isCloseTo(0.3, within(1e-9));
    }

    @Test
    void scoreStaysWithinBounds() {
        double high = scorer.score("SORA invite code beta access key token giveaway sharing redeem signup", "X");
        double low = scorer.score("error exception stack debug", "X");

        assertThat(high).isBetween(ConfidenceScorer.MIN_SCORE, ConfidenceScorer.MAX_SCORE);
        assertThat(low).isBetween(ConfidenceScorer.MIN_SCORE, ConfidenceScorer.MAX_SCORE);
        assertThat(high).isCloseTo(0.95, within(1e-9));
    }

    @Test
    void brandTermIsConfigurable() {
        ConfidenceScorer custom = new ConfidenceScorer(" Veo ");

        assertThat(custom.getBrandTerm()).isEqualTo("veo");
        assertThat(custom.score("veo ABC123", "ABC123")).isCloseTo(0.65, within(1e-9));
        assertThat(custom.score("sora ABC123", "ABC123")).isCloseTo(0.5, within(1e-9));
    }
}
