package com.abusesentinel.core.detection;

/**
 * Contract for one behavioral feature.
 * <p>
 * A scorer reads a {@link BehaviorProfile} and returns a value in
 * {@code [0, 1]}, where higher means more bot-like. Scorers return {@code 0}
 * while the buffers they read hold fewer than {@code minSamples} entries.
 * </p>
 * <p>
 * Scorers hold configuration only. Anything learned per subject lives on the
 * profile.
 * </p>
 */
public interface FeatureScorer {

    /**
     * @return stable name used as the weight key and in event sub-scores
     */
    String name();

    /**
     * Score the profile as of {@code nowMillis}.
     *
     * @param profile   the subject's telemetry
     * @param nowMillis current time
     * @return score in {@code [0, 1]}
     */
    double score(BehaviorProfile profile, long nowMillis);
}
