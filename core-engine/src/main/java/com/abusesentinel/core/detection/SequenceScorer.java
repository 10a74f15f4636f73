package com.abusesentinel.core.detection;

import com.abusesentinel.core.config.ScoringConfig;
import com.abusesentinel.core.model.ActionSample;

import java.util.List;
import java.util.Objects;

/**
 * Scores how much a single action n-gram dominates the long-term history.
 * <p>
 * With dominance {@code d = topCount / total}, the score is
 * {@code clamp((d - 0.3) / 0.7)}. A varied player stays below 0.3 and scores 0.
 * A loop of one macro scores 1.
 * </p>
 */
public class SequenceScorer implements FeatureScorer {

    public static final String NAME = "sequence";

    static final double DOMINANCE_FLOOR = 0.3;

    private final ScoringConfig config;

    public SequenceScorer(ScoringConfig config) {
        this.config = Objects.requireNonNull(config, "ScoringConfig must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double score(BehaviorProfile profile, long nowMillis) {
        List<String> types = profile.actionHistory().stream()
                .map(ActionSample::getActionType)
                .toList();
        int n = config.getNgramSize();
        if (types.size() < config.getMinSamples() || types.size() < n) {
            return 0;
        }
        double dominance = (double) Statistics.topNgramCount(types, n) / Statistics.ngramTotal(types.size(), n);
        return Statistics.clamp01((dominance - DOMINANCE_FLOOR) / (1 - DOMINANCE_FLOOR));
    }
}
