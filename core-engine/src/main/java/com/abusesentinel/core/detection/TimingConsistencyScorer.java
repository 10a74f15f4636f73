package com.abusesentinel.core.detection;

import com.abusesentinel.core.config.ScoringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;

/**
 * Scores the coefficient of variation of inter-action intervals.
 * <p>
 * Scripted clients tend to be either metronomic ({@code cv < lowCvThreshold},
 * scored 0.7) or wildly erratic ({@code cv > highCvThreshold}, scored 0.5).
 * Anything in between scores 0.
 * </p>
 *
 * @since 1.0.0
 */
public class TimingConsistencyScorer implements FeatureScorer {

    private static final Logger LOG = LoggerFactory.getLogger(TimingConsistencyScorer.class);

    public static final String NAME = "timing";

    static final double REGULAR_SCORE = 0.7;
    static final double ERRATIC_SCORE = 0.5;

    private final ScoringConfig config;

    public TimingConsistencyScorer(ScoringConfig config) {
        this.config = Objects.requireNonNull(config, "ScoringConfig must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double score(BehaviorProfile profile, long nowMillis) {
        Collection<BehaviorProfile.TimingSample> samples = profile.timingSamples();
        if (samples.size() < config.getMinSamples()) {
            LOG.trace("Insufficient intervals ({} < {}), skipping", samples.size(), config.getMinSamples());
            return 0;
        }

        double[] intervals = samples.stream()
                .mapToDouble(BehaviorProfile.TimingSample::intervalMillis)
                .toArray();
        double cv = Statistics.coefficientOfVariation(intervals);

        if (cv < config.getLowCvThreshold()) {
            return REGULAR_SCORE;
        }
        if (cv > config.getHighCvThreshold()) {
            return ERRATIC_SCORE;
        }
        return 0;
    }
}
