package com.abusesentinel.core.detection;

import com.abusesentinel.core.config.ScoringConfig;
import com.abusesentinel.core.model.ActionSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flags action bursts that outpace the subject's own learned rate.
 *
 * <h3>Signals</h3>
 * <ul>
 * <li>rate: {@code (n - 1) / span} over the micro action buffer, compared with
 * {@code frequencyMultiple x baseline} (+0.4)</li>
 * <li>regularity: variance of consecutive intervals, in seconds squared,
 * below {@code timingVarianceEpsilon} (+0.3)</li>
 * <li>repetition: the most common action-type n-gram seen more than
 * {@code ngramRepeatThreshold} times (+0.3)</li>
 * </ul>
 *
 * <h3>Baseline</h3>
 * <p>
 * The per-subject baseline starts at 1 action/s and moves toward the observed
 * rate by an exponential moving average, but only while the rate is not
 * flagged. A burst therefore cannot teach the scorer to accept itself.
 * </p>
 *
 * @since 1.0.0
 */
public class ActionFrequencyScorer implements FeatureScorer {

    private static final Logger LOG = LoggerFactory.getLogger(ActionFrequencyScorer.class);

    public static final String NAME = "action";

    static final double BASELINE_RETAIN = 0.95;
    static final double RATE_WEIGHT = 0.4;
    static final double REGULARITY_WEIGHT = 0.3;
    static final double REPETITION_WEIGHT = 0.3;

    private final ScoringConfig config;

    public ActionFrequencyScorer(ScoringConfig config) {
        this.config = Objects.requireNonNull(config, "ScoringConfig must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double score(BehaviorProfile profile, long nowMillis) {
        List<ActionSample> actions = new ArrayList<>(profile.actionSamples());
        int n = actions.size();
        if (n < config.getMinSamples()) {
            LOG.trace("Insufficient actions ({} < {}), skipping", n, config.getMinSamples());
            return 0;
        }

        double score = 0;

        long spanMillis = actions.get(n - 1).getTimestampMillis() - actions.get(0).getTimestampMillis();
        double baseline = profile.getFrequencyBaseline();
        if (spanMillis > 0) {
            double rate = (n - 1) / (spanMillis / 1_000d);
            if (rate > config.getFrequencyMultiple() * baseline) {
                score += RATE_WEIGHT;
            } else {
                profile.setFrequencyBaseline(BASELINE_RETAIN * baseline + (1 - BASELINE_RETAIN) * rate);
            }
        } else {
            // All n actions in the same millisecond.
            score += RATE_WEIGHT;
        }

        double[] intervals = new double[n - 1];
        List<String> types = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            types.add(actions.get(i).getActionType());
            if (i > 0) {
                intervals[i - 1] = (actions.get(i).getTimestampMillis()
                        - actions.get(i - 1).getTimestampMillis()) / 1_000d;
            }
        }
        if (Statistics.variance(intervals) < config.getTimingVarianceEpsilon()) {
            score += REGULARITY_WEIGHT;
        }

        if (Statistics.topNgramCount(types, config.getNgramSize()) > config.getNgramRepeatThreshold()) {
            score += REPETITION_WEIGHT;
        }

        return Math.min(1.0, score);
    }
}
