package com.abusesentinel.core.detection;

import com.abusesentinel.core.config.ScoringConfig;

import java.util.List;
import java.util.Objects;

/**
 * Scores marathon sessions and suspiciously regular session lengths.
 * <p>
 * The ongoing segment scores 0 below one hour, rising linearly to 0.7 at four
 * hours. Three or more completed segments whose lengths have a coefficient of
 * variation below {@code lowCvThreshold} add 0.3.
 * </p>
 */
public class SessionScorer implements FeatureScorer {

    public static final String NAME = "session";

    static final double HOUR_MILLIS = 3_600_000d;
    static final double ONSET_HOURS = 1.0;
    static final double SATURATION_HOURS = 4.0;
    static final double DURATION_CAP = 0.7;
    static final int MIN_SEGMENTS = 3;
    static final double REGULARITY_WEIGHT = 0.3;

    private final ScoringConfig config;

    public SessionScorer(ScoringConfig config) {
        this.config = Objects.requireNonNull(config, "ScoringConfig must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double score(BehaviorProfile profile, long nowMillis) {
        if (profile.actionHistory().size() + profile.movementHistory().size() < config.getMinSamples()) {
            return 0;
        }

        double hours = profile.currentSegmentMillis() / HOUR_MILLIS;
        double score = 0;
        if (hours >= ONSET_HOURS) {
            score = Math.min(DURATION_CAP,
                    DURATION_CAP * (hours - ONSET_HOURS) / (SATURATION_HOURS - ONSET_HOURS));
        }

        List<Long> segments = profile.completedSegments();
        if (segments.size() >= MIN_SEGMENTS) {
            double[] lengths = segments.stream().mapToDouble(Long::doubleValue).toArray();
            if (Statistics.mean(lengths) > 0
                    && Statistics.coefficientOfVariation(lengths) < config.getLowCvThreshold()) {
                score += REGULARITY_WEIGHT;
            }
        }
        return Math.min(1.0, score);
    }
}
