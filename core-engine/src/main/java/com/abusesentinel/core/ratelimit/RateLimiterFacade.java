package com.abusesentinel.core.ratelimit;

import com.abusesentinel.core.metrics.EngineMetrics;
import com.abusesentinel.core.model.DenialKind;
import com.abusesentinel.core.model.EndpointPolicy;
import com.abusesentinel.core.model.GateDecision;
import com.abusesentinel.core.model.PolicyTier;
import com.abusesentinel.core.model.ViolationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Deque;
import java.util.Objects;

/**
 * Single gating decision for one request: resolve the base policy, scale it by
 * the subject's adaptive state, evaluate the sliding window, and record the
 * outcome.
 *
 * <p>
 * Side effects are confined to the subject's own {@link RateLimitState} and
 * the process-wide counters in {@link EngineMetrics}.
 * </p>
 *
 * @since 1.0.0
 */
public class RateLimiterFacade {

    private static final Logger LOG = LoggerFactory.getLogger(RateLimiterFacade.class);

    private final EndpointPolicyTable policyTable;
    private final SlidingWindowLimiter limiter;
    private final AdaptiveThrottle throttle;
    private final EngineMetrics metrics;

    public RateLimiterFacade(EndpointPolicyTable policyTable, SlidingWindowLimiter limiter,
            AdaptiveThrottle throttle, EngineMetrics metrics) {
        this.policyTable = Objects.requireNonNull(policyTable, "EndpointPolicyTable must not be null");
        this.limiter = Objects.requireNonNull(limiter, "SlidingWindowLimiter must not be null");
        this.throttle = Objects.requireNonNull(throttle, "AdaptiveThrottle must not be null");
        this.metrics = Objects.requireNonNull(metrics, "EngineMetrics must not be null");
    }

    /**
     * Check a request and record its outcome.
     *
     * @param subjectId  the requesting subject
     * @param state      the subject's rate-limit state
     * @param endpoint   endpoint being called
     * @param privileged whether the subject is privileged
     * @param nowMillis  current time
     * @return the decision, tagged with the tier that governed it
     */
    public GateDecision checkAndRecord(String subjectId, RateLimitState state, String endpoint,
            boolean privileged, long nowMillis) {
        PolicyTier tier = policyTable.effectiveTier(endpoint, privileged);
        EndpointPolicy effective = throttle.scale(policyTable.policyFor(tier), state.adaptive());

        Deque<Long> sequence = state.requests(endpoint);
        GateDecision decision = limiter.evaluate(sequence, effective, nowMillis).withTier(tier);

        if (decision.isAllowed()) {
            limiter.record(sequence, nowMillis);
            metrics.incrementAllowed(tier);
            return decision;
        }

        // a denial is always tagged with its kind
        DenialKind kind = decision.getKind().orElseThrow();
        boolean escalated = throttle.onViolation(state.adaptive(), nowMillis);
        state.addViolation(new ViolationRecord(subjectId, endpoint, decision.getReason(), kind,
                Instant.ofEpochMilli(nowMillis)));
        metrics.incrementDenied(tier, kind);

        if (escalated) {
            LOG.info("Subject [{}] throttle escalated to x{} after {} violation(s) on {}",
                    subjectId, state.adaptive().getThrottleMultiplier(),
                    state.adaptive().getViolationCount(), endpoint);
        } else {
            LOG.debug("Subject [{}] denied on {}: {}", subjectId, endpoint, decision.getReason());
        }
        return decision;
    }

    public EndpointPolicyTable policyTable() {
        return policyTable;
    }

    public AdaptiveThrottle throttle() {
        return throttle;
    }
}
