package com.abusesentinel.core.detection;

import com.abusesentinel.core.config.ScoringConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SequenceScorer}.
 */
class SequenceScorerTest {

    private SequenceScorer scorer;
    private BehaviorProfile profile;

    @BeforeEach
    void setUp() {
        ScoringConfig config = new ScoringConfig();
        scorer = new SequenceScorer(config);
        profile = new BehaviorProfile(config);
    }

    @Test
    @DisplayName("Should score a single repeated action as fully dominant")
    void shouldFlagSingleAction() {
        for (int i = 0; i < 20; i++) {
            profile.recordAction("Collect", null, i * 1_000L);
        }
        assertThat(scorer.score(profile, 19_000)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should score a three-step loop by its trigram dominance")
    void shouldScoreLoop() {
        String[] loop = { "Pickup", "Move", "Place" };
        for (int i = 0; i < 30; i++) {
            profile.recordAction(loop[i % 3], null, i * 1_000L);
        }
        double dominance = 10 / 28.0;
        assertThat(scorer.score(profile, 29_000)).isCloseTo((dominance - 0.3) / 0.7, within(1e-9));
    }

    @Test
    @DisplayName("Should score varied play as 0")
    void shouldAcceptVariedPlay() {
        for (int i = 0; i < 20; i++) {
            profile.recordAction("Action" + i, null, i * 1_000L);
        }
        assertThat(scorer.score(profile, 19_000)).isZero();
    }
}
