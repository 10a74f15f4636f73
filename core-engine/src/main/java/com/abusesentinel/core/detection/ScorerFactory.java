package com.abusesentinel.core.detection;

import com.abusesentinel.core.config.ScoringConfig;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Creates {@link FeatureScorer} instances by name.
 *
 * <p>
 * This is the single point of extension when adding a feature: register its
 * name here, give it a weight in {@code FeatureWeights}, and add it to the
 * cadence it belongs to.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScorerFactory {

    /** Scorers evaluated on every micro tick. */
    public static final List<String> MICRO = List.of(
            ActionFrequencyScorer.NAME, TimingConsistencyScorer.NAME, MovementScorer.NAME);

    /** Scorers evaluated on every macro tick. */
    public static final List<String> MACRO = List.of(
            SessionScorer.NAME, SequenceScorer.NAME, VelocityScorer.NAME);

    private ScorerFactory() {
        // utility class
    }

    /**
     * @param name   scorer name
     * @param config scoring configuration
     * @return a new scorer
     * @throws IllegalArgumentException if the name is unknown
     */
    public static FeatureScorer create(String name, ScoringConfig config) {
        Objects.requireNonNull(name, "Scorer name must not be null");
        return switch (name.toLowerCase(Locale.ROOT)) {
            case ActionFrequencyScorer.NAME -> new ActionFrequencyScorer(config);
            case TimingConsistencyScorer.NAME -> new TimingConsistencyScorer(config);
            case MovementScorer.NAME -> new MovementScorer(config);
            case SessionScorer.NAME -> new SessionScorer(config);
            case SequenceScorer.NAME -> new SequenceScorer(config);
            case VelocityScorer.NAME -> new VelocityScorer(config);
            default -> throw new IllegalArgumentException(
                    "Unknown scorer: '" + name + "'. Supported: " + MICRO + " " + MACRO);
        };
    }

    public static List<FeatureScorer> microScorers(ScoringConfig config) {
        return MICRO.stream().map(name -> create(name, config)).toList();
    }

    public static List<FeatureScorer> macroScorers(ScoringConfig config) {
        return MACRO.stream().map(name -> create(name, config)).toList();
    }
}
