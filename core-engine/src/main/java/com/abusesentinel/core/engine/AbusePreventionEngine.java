package com.abusesentinel.core.engine;

import com.abusesentinel.core.config.EngineConfig;
import com.abusesentinel.core.config.ScheduleConfig;
import com.abusesentinel.core.config.ScoringConfig;
import com.abusesentinel.core.config.ThrottleConfig;
import com.abusesentinel.core.detection.AnomalyAggregator;
import com.abusesentinel.core.detection.BehaviorProfile;
import com.abusesentinel.core.detection.Classification;
import com.abusesentinel.core.metrics.EngineMetrics;
import com.abusesentinel.core.model.AdaptiveState;
import com.abusesentinel.core.model.AnomalyEvent;
import com.abusesentinel.core.model.BehaviorAnalysis;
import com.abusesentinel.core.model.GateDecision;
import com.abusesentinel.core.model.PolicyTier;
import com.abusesentinel.core.model.Vector3;
import com.abusesentinel.core.model.ViolationRecord;
import com.abusesentinel.core.ratelimit.AdaptiveThrottle;
import com.abusesentinel.core.ratelimit.EndpointPolicyTable;
import com.abusesentinel.core.ratelimit.RateLimitState;
import com.abusesentinel.core.ratelimit.RateLimiterFacade;
import com.abusesentinel.core.ratelimit.SlidingWindowLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the abuse-prevention engine.
 *
 * <p>
 * Gates requests per subject and endpoint, ingests behavioral telemetry, and
 * runs the periodic scoring that feeds anomalies back into the throttle.
 * </p>
 *
 * <h3>Threading</h3>
 * <p>
 * Not thread-safe. Every call, including the ticks, must come from one thread
 * or be serialized by the host. Timestamps are supplied by the caller and
 * expected to be non-decreasing.
 * </p>
 *
 * <h3>Feedback loop</h3>
 * <ul>
 * <li>rate-limit denials escalate the subject's throttle and count towards
 * its risk score</li>
 * <li>a micro anomaly event escalates the throttle like a denial</li>
 * <li>a macro category escalation only notifies</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class AbusePreventionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AbusePreventionEngine.class);

    private static final long UNSET = Long.MIN_VALUE;

    private final EngineConfig config;
    private final SubjectStateStore store;
    private final RateLimiterFacade rateLimiter;
    private final AdaptiveThrottle throttle;
    private final AnomalyAggregator aggregator;
    private final AnomalyListener anomalyListener;
    private final SubjectArchiver archiver;
    private final PrivilegeResolver privilegeResolver;
    private final EngineMetrics metrics;
    private final long maxRequestWindowMillis;

    private long lastMacroTickMillis = UNSET;
    private long lastCleanupMillis = UNSET;

    private AbusePreventionEngine(Builder builder) {
        this.config = builder.config.copy();
        this.config.validate();
        this.anomalyListener = builder.anomalyListener;
        this.archiver = builder.archiver;
        this.privilegeResolver = builder.privilegeResolver;
        this.metrics = new EngineMetrics(builder.meterRegistry);

        EndpointPolicyTable policyTable = EndpointPolicyTable.fromConfig(config);
        this.throttle = new AdaptiveThrottle(config.getThrottle());
        this.rateLimiter = new RateLimiterFacade(policyTable, new SlidingWindowLimiter(), throttle, metrics);
        this.aggregator = new AnomalyAggregator(config.getScoring());
        this.store = new SubjectStateStore(config.getScoring());
        this.metrics.bindTrackedSubjects(store::size);

        long longestWindow = 0;
        for (PolicyTier tier : PolicyTier.values()) {
            longestWindow = Math.max(longestWindow, policyTable.policyFor(tier).windowMillis());
        }
        this.maxRequestWindowMillis = (long) Math.ceil(longestWindow * config.getThrottle().getMaxMultiplier());

        LOG.info("Abuse prevention engine initialised: {}", config);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Gating
    // ---------------------------------------------------------------

    /**
     * Gate a request, consulting the {@link PrivilegeResolver} for the tier.
     *
     * @see #checkAndRecord(String, String, boolean, long)
     */
    public GateDecision checkAndRecord(String subjectId, String endpoint, long nowMillis) {
        requireId(subjectId, "subjectId");
        return checkAndRecord(subjectId, endpoint, privilegeResolver.isPrivileged(subjectId), nowMillis);
    }

    /**
     * Gate a request and record it if allowed.
     *
     * @param subjectId  requesting subject; must not be null or blank
     * @param endpoint   endpoint called; must not be null or blank
     * @param privileged whether the privileged tier applies
     * @param nowMillis  request time
     * @return the decision; a denial carries a human-readable reason
     * @throws NullPointerException     if an id is {@code null}
     * @throws IllegalArgumentException if an id is blank
     */
    public GateDecision checkAndRecord(String subjectId, String endpoint, boolean privileged, long nowMillis) {
        requireId(subjectId, "subjectId");
        requireId(endpoint, "endpoint");
        SubjectState state = touch(subjectId, nowMillis);
        return rateLimiter.checkAndRecord(subjectId, state.rateLimit(), endpoint, privileged, nowMillis);
    }

    // ---------------------------------------------------------------
    // Telemetry
    // ---------------------------------------------------------------

    /**
     * Record an action for behavioral scoring.
     *
     * @param subjectId  acting subject
     * @param actionType action name
     * @param data       optional payload
     * @param nowMillis  action time
     */
    public void recordAction(String subjectId, String actionType, Map<String, Object> data, long nowMillis) {
        requireId(subjectId, "subjectId");
        requireId(actionType, "actionType");
        touch(subjectId, nowMillis).profile().recordAction(actionType, data, nowMillis);
    }

    /**
     * Record a movement report for behavioral scoring.
     *
     * @param subjectId subject that moved
     * @param position  reported position; must not be {@code null}
     * @param velocity  reported velocity, {@code null} meaning at rest
     * @param nowMillis report time
     */
    public void recordMovement(String subjectId, Vector3 position, Vector3 velocity, long nowMillis) {
        requireId(subjectId, "subjectId");
        Objects.requireNonNull(position, "position must not be null");
        touch(subjectId, nowMillis).profile().recordMovement(position, velocity, nowMillis);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * Current analysis of a subject. Never creates state.
     *
     * @param subjectId the subject
     * @return the analysis, or {@link BehaviorAnalysis#fresh} if unknown
     */
    public BehaviorAnalysis getAnalysis(String subjectId) {
        requireId(subjectId, "subjectId");
        return store.find(subjectId)
                .map(this::analyse)
                .orElseGet(() -> BehaviorAnalysis.fresh(subjectId));
    }

    public AdaptiveState.Snapshot getAdaptiveState(String subjectId) {
        requireId(subjectId, "subjectId");
        return store.find(subjectId)
                .map(state -> state.rateLimit().adaptive().snapshot())
                .orElseGet(AdaptiveState.Snapshot::neutral);
    }

    /**
     * @return the subject's retained violations, oldest first; empty if unknown
     */
    public List<ViolationRecord> getViolations(String subjectId) {
        requireId(subjectId, "subjectId");
        return store.find(subjectId)
                .map(state -> state.rateLimit().violations())
                .orElse(Collections.emptyList());
    }

    public int trackedSubjects() {
        return store.size();
    }

    public EngineMetrics metrics() {
        return metrics;
    }

    /**
     * @return a copy of the configuration the engine was built with; changing
     *         it has no effect on the engine
     */
    public EngineConfig config() {
        return config.copy();
    }

    // ---------------------------------------------------------------
    // Scheduled work
    // ---------------------------------------------------------------

    /**
     * Run the micro tick, and the macro tick and cleanup when their intervals
     * have elapsed. The first call only starts those intervals.
     *
     * @param nowMillis current time
     */
    public void tick(long nowMillis) {
        microTick(nowMillis);

        ScheduleConfig schedule = config.getSchedule();
        if (lastMacroTickMillis == UNSET) {
            lastMacroTickMillis = nowMillis;
        } else if (nowMillis - lastMacroTickMillis >= schedule.getMacroTickMillis()) {
            macroTick(nowMillis);
        }
        if (lastCleanupMillis == UNSET) {
            lastCleanupMillis = nowMillis;
        } else if (nowMillis - lastCleanupMillis >= schedule.getEvictionIntervalMillis()) {
            cleanup(nowMillis);
        }
    }

    /**
     * Rescore every subject's micro buffers and raise immediate anomaly events.
     *
     * @param nowMillis current time
     */
    public void microTick(long nowMillis) {
        long start = System.nanoTime();
        for (SubjectState state : store.snapshot()) {
            try {
                microScore(state, nowMillis);
            } catch (RuntimeException e) {
                LOG.error("Micro scoring failed for subject [{}], continuing with next subject",
                        state.getSubjectId(), e);
            }
        }
        metrics.recordTick("micro", System.nanoTime() - start);
    }

    /**
     * Decay throttles, recompute risk scores and reclassify every subject.
     *
     * @param nowMillis current time
     */
    public void macroTick(long nowMillis) {
        long start = System.nanoTime();
        ThrottleConfig throttleConfig = config.getThrottle();
        ScoringConfig scoring = config.getScoring();
        long retention = seconds(throttleConfig.getViolationRetentionSeconds());
        long riskWindow = seconds(scoring.getViolationRiskWindowSeconds());

        for (SubjectState state : store.snapshot()) {
            try {
                macroScore(state, retention, riskWindow, nowMillis);
            } catch (RuntimeException e) {
                LOG.error("Macro scoring failed for subject [{}], continuing with next subject",
                        state.getSubjectId(), e);
            }
        }
        lastMacroTickMillis = nowMillis;
        metrics.recordTick("macro", System.nanoTime() - start);
    }

    /**
     * Prune every buffer and evict subjects idle for longer than
     * {@code idleEvictionSeconds}, archiving them first.
     *
     * @param nowMillis current time
     */
    public void cleanup(long nowMillis) {
        long start = System.nanoTime();
        long retention = seconds(config.getThrottle().getViolationRetentionSeconds());
        long idleLimit = seconds(config.getSchedule().getIdleEvictionSeconds());
        int evicted = 0;

        for (SubjectState state : store.snapshot()) {
            if (nowMillis - state.getLastActivityMillis() > idleLimit) {
                evict(state);
                evicted++;
                continue;
            }
            state.rateLimit().pruneRequests(maxRequestWindowMillis, nowMillis);
            state.rateLimit().pruneViolations(retention, nowMillis);
            state.profile().prune(nowMillis);
        }
        if (evicted > 0) {
            LOG.info("Evicted {} idle subject(s), {} remain", evicted, store.size());
        }
        lastCleanupMillis = nowMillis;
        metrics.recordTick("cleanup", System.nanoTime() - start);
    }

    /**
     * Archive and forget a subject. Unknown ids are ignored.
     *
     * @param subjectId the departing subject
     */
    public void onDisconnect(String subjectId) {
        requireId(subjectId, "subjectId");
        Optional<SubjectState> state = store.find(subjectId);
        if (state.isEmpty()) {
            LOG.debug("Disconnect for unknown subject [{}] ignored", subjectId);
            return;
        }
        evict(state.get());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private SubjectState touch(String subjectId, long nowMillis) {
        SubjectState state = store.getOrCreate(subjectId, nowMillis);
        state.touch(nowMillis);
        return state;
    }

    private void microScore(SubjectState state, long nowMillis) {
        BehaviorProfile profile = state.profile();
        double score = aggregator.microScore(profile, nowMillis);
        if (!aggregator.claimMicroEvent(profile, score, nowMillis)) {
            return;
        }
        throttle.onViolation(state.rateLimit().adaptive(), nowMillis);
        Classification classification = AnomalyAggregator.classify(profile.getRiskScore(), score);
        emit(AnomalyEvent.builder()
                .subjectId(state.getSubjectId())
                .source(AnomalyEvent.Source.MICRO)
                .score(score)
                .category(classification.getCategory())
                .details(String.format("Anomaly score %.2f reached threshold %.2f",
                        score, config.getScoring().getAnomalyEventThreshold()))
                .subScores(profile.getSubScores())
                .timestamp(Instant.ofEpochMilli(nowMillis))
                .build());
    }

    private void macroScore(SubjectState state, long retention, long riskWindow, long nowMillis) {
        RateLimitState rateLimit = state.rateLimit();
        if (throttle.decay(rateLimit.adaptive(), nowMillis)) {
            LOG.debug("Subject [{}] throttle relaxed to x{}", state.getSubjectId(),
                    rateLimit.adaptive().getThrottleMultiplier());
        }
        rateLimit.pruneViolations(retention, nowMillis);

        BehaviorProfile profile = state.profile();
        double risk = aggregator.macroScore(profile, rateLimit.violationsSince(nowMillis - riskWindow), nowMillis);
        Classification classification = AnomalyAggregator.classify(risk, profile.getAnomalyScore());

        if (AnomalyAggregator.isEscalation(profile.getLastCategory(), classification.getCategory())) {
            emit(AnomalyEvent.builder()
                    .subjectId(state.getSubjectId())
                    .source(AnomalyEvent.Source.MACRO)
                    .score(classification.getCombined())
                    .category(classification.getCategory())
                    .details(String.format("Classification escalated from %s to %s",
                            profile.getLastCategory(), classification.getCategory()))
                    .subScores(profile.getSubScores())
                    .timestamp(Instant.ofEpochMilli(nowMillis))
                    .build());
        }
        profile.setLastCategory(classification.getCategory());
    }

    private BehaviorAnalysis analyse(SubjectState state) {
        BehaviorProfile profile = state.profile();
        Classification classification = AnomalyAggregator.classify(profile.getRiskScore(), profile.getAnomalyScore());
        return new BehaviorAnalysis(state.getSubjectId(), profile.getRiskScore(), profile.getAnomalyScore(),
                classification.getCategory(), classification.getConfidence(), profile.sampleCount());
    }

    private void evict(SubjectState state) {
        String subjectId = state.getSubjectId();
        if (archiver != null) {
            try {
                archiver.archive(subjectId, analyse(state), state.rateLimit().violations());
            } catch (RuntimeException e) {
                metrics.incrementListenerFailures();
                LOG.warn("Archiver failed for subject [{}]; state is dropped regardless", subjectId, e);
            }
        }
        store.remove(subjectId);
        metrics.incrementEvicted();
    }

    private void emit(AnomalyEvent event) {
        metrics.incrementAnomalies(event.getSource());
        LOG.warn("Anomaly [{}] subject={} score={} category={}: {}", event.getSource(),
                event.getSubjectId(), String.format("%.3f", event.getScore()), event.getCategory(),
                event.getDetails());
        try {
            anomalyListener.onAnomaly(event);
        } catch (RuntimeException e) {
            metrics.incrementListenerFailures();
            LOG.warn("Anomaly listener failed for subject [{}]", event.getSubjectId(), e);
        }
    }

    private static long seconds(double seconds) {
        return Math.round(seconds * 1_000d);
    }

    private static void requireId(String value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AbusePreventionEngine}. Every collaborator is
     * optional.
     */
    public static class Builder {
        private EngineConfig config = EngineConfig.defaults();
        private AnomalyListener anomalyListener = AnomalyListener.noop();
        private SubjectArchiver archiver;
        private PrivilegeResolver privilegeResolver = PrivilegeResolver.none();
        private MeterRegistry meterRegistry;

        public Builder config(EngineConfig config) {
            this.config = Objects.requireNonNull(config, "EngineConfig must not be null");
            return this;
        }

        public Builder anomalyListener(AnomalyListener anomalyListener) {
            this.anomalyListener = Objects.requireNonNull(anomalyListener, "AnomalyListener must not be null");
            return this;
        }

        /**
         * @param archiver receives departing subjects; {@code null} disables
         *                 archiving
         */
        public Builder archiver(SubjectArchiver archiver) {
            this.archiver = archiver;
            return this;
        }

        public Builder privilegeResolver(PrivilegeResolver privilegeResolver) {
            this.privilegeResolver = Objects.requireNonNull(privilegeResolver,
                    "PrivilegeResolver must not be null");
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry must not be null");
            return this;
        }

        /**
         * @return a new engine
         * @throws IllegalStateException if the configuration is invalid
         */
        public AbusePreventionEngine build() {
            if (meterRegistry == null) {
                meterRegistry = new SimpleMeterRegistry();
            }
            return new AbusePreventionEngine(this);
        }
    }
}
