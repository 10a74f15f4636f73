package com.abusesentinel.core.detection;

import com.abusesentinel.core.config.ScoringConfig;
import com.abusesentinel.core.model.MovementSample;
import com.abusesentinel.core.model.Vector3;

import java.util.Objects;

/**
 * Scores reported velocities over the long-term movement history.
 * <p>
 * Only samples with a nonzero reported velocity count. The share of those
 * above {@code maxSpeed}, doubled, is the base score. A speed coefficient of
 * variation below {@code lowCvThreshold} adds 0.3, as humans rarely hold a
 * perfectly constant speed.
 * </p>
 */
public class VelocityScorer implements FeatureScorer {

    public static final String NAME = "velocity";

    static final double OVER_SPEED_FACTOR = 2.0;
    static final double CONSTANT_SPEED_WEIGHT = 0.3;

    private final ScoringConfig config;

    public VelocityScorer(ScoringConfig config) {
        this.config = Objects.requireNonNull(config, "ScoringConfig must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double score(BehaviorProfile profile, long nowMillis) {
        double[] speeds = profile.movementHistory().stream()
                .map(MovementSample::getVelocity)
                .mapToDouble(Vector3::magnitude)
                .filter(speed -> speed > 0)
                .toArray();
        if (speeds.length < config.getMinSamples()) {
            return 0;
        }

        long overSpeed = 0;
        for (double speed : speeds) {
            if (speed > config.getMaxSpeed()) {
                overSpeed++;
            }
        }
        double score = Math.min(1.0, OVER_SPEED_FACTOR * overSpeed / speeds.length);
        if (Statistics.coefficientOfVariation(speeds) < config.getLowCvThreshold()) {
            score += CONSTANT_SPEED_WEIGHT;
        }
        return Math.min(1.0, score);
    }
}
