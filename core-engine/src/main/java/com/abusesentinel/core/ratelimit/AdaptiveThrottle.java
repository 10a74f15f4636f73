package com.abusesentinel.core.ratelimit;

import com.abusesentinel.core.config.ThrottleConfig;
import com.abusesentinel.core.model.AdaptiveState;
import com.abusesentinel.core.model.EndpointPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Scales endpoint policies by a per-subject multiplier that escalates on
 * repeated violations and relaxes after sustained good behavior.
 *
 * <h3>Escalation</h3>
 * <p>
 * Every violation increments the count. Once the count reaches
 * {@code violationThreshold}, each further violation multiplies the
 * multiplier by {@code escalationFactor} (capped at {@code maxMultiplier}) and
 * trust by {@code trustDecayFactor} (floored at {@code minTrust}).
 * </p>
 *
 * <h3>Recovery</h3>
 * <p>
 * {@link #decay(AdaptiveState, long)} only acts after {@code quietPeriod}
 * without violations. Each step relaxes the multiplier and restores trust;
 * once the multiplier drops below {@code resetCutoff} the state snaps back to
 * neutral. Recovery is deliberately slower than escalation.
 * </p>
 *
 * @since 1.0.0
 */
public class AdaptiveThrottle {

    private static final Logger LOG = LoggerFactory.getLogger(AdaptiveThrottle.class);

    private final ThrottleConfig config;

    public AdaptiveThrottle(ThrottleConfig config) {
        this.config = Objects.requireNonNull(config, "ThrottleConfig must not be null");
    }

    /**
     * Produce the effective policy for a subject.
     *
     * <p>
     * Counts are divided by the multiplier (floored, minimum 1); durations are
     * multiplied by it. A neutral state returns {@code policy} unchanged.
     * </p>
     *
     * @param policy base policy
     * @param state  subject's adaptive state
     * @return the scaled policy
     */
    public EndpointPolicy scale(EndpointPolicy policy, AdaptiveState state) {
        double m = state.getThrottleMultiplier();
        if (m <= AdaptiveState.NEUTRAL_MULTIPLIER) {
            return policy;
        }
        return new EndpointPolicy(
                policy.getTierName(),
                Math.max(1, (int) Math.floor(policy.getMaxRequests() / m)),
                policy.getWindowSeconds() * m,
                Math.max(1, (int) Math.floor(policy.getBurstLimit() / m)),
                policy.getCooldownSeconds() * m);
    }

    /**
     * Register a violation against {@code state}.
     *
     * @param state     subject's adaptive state
     * @param nowMillis time of the violation
     * @return {@code true} if this violation escalated the multiplier
     */
    public boolean onViolation(AdaptiveState state, long nowMillis) {
        state.setViolationCount(state.getViolationCount() + 1);
        state.setLastViolationMillis(nowMillis);

        if (state.getViolationCount() < config.getViolationThreshold()) {
            return false;
        }
        state.setThrottleMultiplier(Math.min(config.getMaxMultiplier(),
                state.getThrottleMultiplier() * config.getEscalationFactor()));
        state.setTrustScore(Math.max(config.getMinTrust(),
                state.getTrustScore() * config.getTrustDecayFactor()));
        LOG.debug("Throttle escalated: violations={} multiplier={} trust={}",
                state.getViolationCount(), state.getThrottleMultiplier(), state.getTrustScore());
        return true;
    }

    /**
     * Apply one recovery step if the subject has been quiet long enough.
     *
     * @param state     subject's adaptive state
     * @param nowMillis current time
     * @return {@code true} if the state changed
     */
    public boolean decay(AdaptiveState state, long nowMillis) {
        if (!state.hasViolated() || isNeutral(state)) {
            return false;
        }
        long quietMillis = Math.round(config.getQuietPeriodSeconds() * 1_000d);
        if (nowMillis - state.getLastViolationMillis() <= quietMillis) {
            return false;
        }

        double relaxed = state.getThrottleMultiplier() * config.getRelaxFactor();
        if (relaxed < config.getResetCutoff()) {
            state.reset();
            LOG.debug("Throttle fully reset after quiet period");
        } else {
            state.setThrottleMultiplier(relaxed);
            state.setTrustScore(state.getTrustScore() * config.getTrustRecoveryFactor());
        }
        return true;
    }

    private static boolean isNeutral(AdaptiveState state) {
        return state.getViolationCount() == 0
                && state.getThrottleMultiplier() == AdaptiveState.NEUTRAL_MULTIPLIER
                && state.getTrustScore() == AdaptiveState.FULL_TRUST;
    }
}
