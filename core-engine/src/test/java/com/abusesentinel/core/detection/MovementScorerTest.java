package com.abusesentinel.core.detection;

import com.abusesentinel.core.config.ScoringConfig;
import com.abusesentinel.core.model.Vector3;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link MovementScorer}.
 */
class MovementScorerTest {

    private MovementScorer scorer;
    private BehaviorProfile profile;

    @BeforeEach
    void setUp() {
        ScoringConfig config = new ScoringConfig();
        scorer = new MovementScorer(config);
        profile = new BehaviorProfile(config);
    }

    @Test
    @DisplayName("Should add 0.2 per over-speed segment up to 0.6")
    void shouldFlagTeleports() {
        double x = 0;
        for (int i = 0; i < 12; i++) {
            // 10 studs/s normally, with three 500-stud jumps
            x += i % 3 == 0 && i > 0 ? 500 : 1;
            profile.recordMovement(new Vector3(x, 0, 0), null, i * 100L);
        }
        assertThat(scorer.score(profile, 1_100)).isCloseTo(0.6, within(1e-9));
    }

    @Test
    @DisplayName("Should flag a repeating zig-zag path")
    void shouldFlagRepeatingPath() {
        double x = 0;
        double z = 0;
        for (int i = 0; i < 13; i++) {
            if (i % 2 == 0) {
                x += 1;
            } else {
                z += 1;
            }
            profile.recordMovement(new Vector3(x, 0, z), null, i * 100L);
        }
        assertThat(scorer.score(profile, 1_200)).isCloseTo(0.4, within(1e-9));
    }

    @Test
    @DisplayName("Should not treat a straight walk or standing still as a pattern")
    void shouldAcceptPlainMovement() {
        for (int i = 0; i < 15; i++) {
            profile.recordMovement(new Vector3(i, 0, 0), null, i * 100L);
        }
        assertThat(scorer.score(profile, 1_400)).isZero();

        BehaviorProfile idle = new BehaviorProfile(new ScoringConfig());
        for (int i = 0; i < 15; i++) {
            idle.recordMovement(new Vector3(5, 0, 5), null, i * 100L);
        }
        assertThat(scorer.score(idle, 1_400)).isZero();
    }

    @Test
    @DisplayName("Should score overflowing jumps between huge coordinates as over-speed")
    void shouldScoreOverflowingJumps() {
        for (int i = 0; i < 12; i++) {
            double x = i % 2 == 0 ? 1e308 : -1e308;
            profile.recordMovement(new Vector3(x, 0, 0), null, i * 100L);
        }
        assertThat(scorer.score(profile, 1_100)).isCloseTo(0.6, within(1e-9));
    }

    @Test
    @DisplayName("Should return 0 below minSamples")
    void shouldIgnoreInsufficientData() {
        profile.recordMovement(new Vector3(0, 0, 0), null, 0);
        profile.recordMovement(new Vector3(1_000, 0, 0), null, 10);
        assertThat(scorer.score(profile, 10)).isZero();
    }
}
