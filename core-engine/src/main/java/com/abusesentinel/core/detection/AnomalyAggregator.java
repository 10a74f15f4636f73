package com.abusesentinel.core.detection;

import com.abusesentinel.core.config.FeatureWeights;
import com.abusesentinel.core.config.ScoringConfig;
import com.abusesentinel.core.model.BehaviorCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Combines feature scores into the anomaly and risk scores and classifies
 * subjects.
 *
 * <h3>Cadences</h3>
 * <ul>
 * <li>{@link #microScore}: weighted mean of the micro scorers, stored on the
 * profile as its anomaly score</li>
 * <li>{@link #macroScore}: weighted mean of the macro scorers plus violation
 * pressure, stored on the profile as its risk score</li>
 * </ul>
 *
 * <h3>Classification</h3>
 * <p>
 * {@link #classify} is a pure function of the two scores. Their mean selects
 * the category by fixed thresholds; the category is never latched.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyAggregator.class);

    static final double SUSPICIOUS_THRESHOLD = 0.2;
    static final double BOT_LIKE_THRESHOLD = 0.4;
    static final double EXPLOIT_THRESHOLD = 0.6;
    static final double ADVANCED_EXPLOIT_THRESHOLD = 0.8;

    private final ScoringConfig config;
    private final List<FeatureScorer> microScorers;
    private final List<FeatureScorer> macroScorers;

    public AnomalyAggregator(ScoringConfig config) {
        this(config, ScorerFactory.microScorers(config), ScorerFactory.macroScorers(config));
    }

    AnomalyAggregator(ScoringConfig config, List<FeatureScorer> microScorers, List<FeatureScorer> macroScorers) {
        this.config = Objects.requireNonNull(config, "ScoringConfig must not be null");
        this.microScorers = List.copyOf(microScorers);
        this.macroScorers = List.copyOf(macroScorers);
    }

    /**
     * Prune the profile's buffers and recompute its anomaly score.
     *
     * @param profile   subject telemetry
     * @param nowMillis current time
     * @return the new anomaly score in {@code [0, 1]}
     */
    public double microScore(BehaviorProfile profile, long nowMillis) {
        profile.prune(nowMillis);
        double score = weightedMean(microScorers, profile, nowMillis);
        profile.setAnomalyScore(score);
        return score;
    }

    /**
     * Recompute the profile's risk score.
     *
     * @param profile            subject telemetry
     * @param recentViolations   rate-limit violations inside
     *                           {@code violationRiskWindowSeconds}
     * @param nowMillis          current time
     * @return the new risk score in {@code [0, 1]}
     */
    public double macroScore(BehaviorProfile profile, int recentViolations, long nowMillis) {
        profile.prune(nowMillis);
        double behavioral = weightedMean(macroScorers, profile, nowMillis);
        double pressure = Math.min(config.getViolationRiskCap(),
                config.getViolationRiskWeight() * recentViolations);
        double score = Statistics.clamp01(behavioral + pressure);
        profile.setRiskScore(score);
        return score;
    }

    /**
     * Map a risk/anomaly pair to a category and a confidence.
     *
     * @param riskScore    macro risk score
     * @param anomalyScore micro anomaly score
     * @return the classification; equal inputs always give equal results
     */
    public static Classification classify(double riskScore, double anomalyScore) {
        double combined = (riskScore + anomalyScore) / 2;
        BehaviorCategory category;
        if (combined < SUSPICIOUS_THRESHOLD) {
            category = BehaviorCategory.NORMAL;
        } else if (combined < BOT_LIKE_THRESHOLD) {
            category = BehaviorCategory.SUSPICIOUS;
        } else if (combined < EXPLOIT_THRESHOLD) {
            category = BehaviorCategory.BOT_LIKE;
        } else if (combined < ADVANCED_EXPLOIT_THRESHOLD) {
            category = BehaviorCategory.EXPLOIT_ATTEMPT;
        } else {
            category = BehaviorCategory.ADVANCED_EXPLOIT;
        }
        double confidence = category == BehaviorCategory.NORMAL ? 1 - combined : combined;
        return new Classification(category, confidence, combined);
    }

    /**
     * @return {@code true} if moving from {@code previous} to {@code current}
     *         is an upward step that lands on {@code BOT_LIKE} or above
     */
    public static boolean isEscalation(BehaviorCategory previous, BehaviorCategory current) {
        return current.isAtLeast(BehaviorCategory.BOT_LIKE) && current.compareTo(previous) > 0;
    }

    /**
     * Decide whether a micro score warrants an immediate event, and if so stamp
     * the profile so the per-subject cooldown starts.
     *
     * @param profile   subject telemetry
     * @param score     anomaly score just computed
     * @param nowMillis current time
     * @return {@code true} if an event should be emitted now
     */
    public boolean claimMicroEvent(BehaviorProfile profile, double score, long nowMillis) {
        if (score < config.getAnomalyEventThreshold()) {
            return false;
        }
        long last = profile.getLastAnomalyEventMillis();
        long cooldown = Math.round(config.getAnomalyEventCooldownSeconds() * 1_000d);
        if (last != Long.MIN_VALUE && nowMillis - last < cooldown) {
            LOG.trace("Anomaly event suppressed by cooldown ({} ms since last)", nowMillis - last);
            return false;
        }
        profile.setLastAnomalyEventMillis(nowMillis);
        return true;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private double weightedMean(List<FeatureScorer> scorers, BehaviorProfile profile, long nowMillis) {
        FeatureWeights weights = config.getWeights();
        double weighted = 0;
        double total = 0;
        for (FeatureScorer scorer : scorers) {
            double s = Statistics.clamp01(scorer.score(profile, nowMillis));
            double w = weights.weightOf(scorer.name());
            profile.putSubScore(scorer.name(), s);
            weighted += w * s;
            total += w;
        }
        return total > 0 ? weighted / total : 0;
    }
}
