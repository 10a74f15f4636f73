package com.abusesentinel.core.detection;

import com.abusesentinel.core.config.ScoringConfig;
import com.abusesentinel.core.model.ActionSample;
import com.abusesentinel.core.model.BehaviorCategory;
import com.abusesentinel.core.model.MovementSample;
import com.abusesentinel.core.model.Vector3;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rolling behavioral telemetry for one subject.
 *
 * <h3>Buffers</h3>
 * <ul>
 * <li>micro: actions, inter-action intervals and movements from the last
 * {@code microRetentionSeconds}</li>
 * <li>macro: actions and movements from the last
 * {@code macroRetentionSeconds}</li>
 * <li>session: lengths of completed activity segments, split wherever the
 * subject was idle for longer than {@code sessionIdleGapSeconds}</li>
 * </ul>
 * <p>
 * Every buffer is pruned by age on write and on {@link #prune(long)}, and is
 * additionally capped at {@code maxBufferSize} entries.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * This class is <strong>stateful</strong> and not thread-safe. One instance is
 * held per subject and only touched by that subject's calls and ticks.
 * </p>
 *
 * @since 1.0.0
 */
public class BehaviorProfile {

    /** Completed session segments kept for the session scorer. */
    static final int MAX_SESSION_SEGMENTS = 50;

    private final ScoringConfig config;

    // --- Micro buffers ---
    private final Deque<ActionSample> actionSamples = new ArrayDeque<>();
    private final Deque<TimingSample> timingSamples = new ArrayDeque<>();
    private final Deque<MovementSample> movementSamples = new ArrayDeque<>();

    // --- Macro buffers ---
    private final Deque<ActionSample> actionHistory = new ArrayDeque<>();
    private final Deque<MovementSample> movementHistory = new ArrayDeque<>();

    // --- Session ---
    private final Deque<Long> sessionSegments = new ArrayDeque<>();
    private long currentSegmentStart = -1L;
    private long lastActivityMillis = -1L;
    private long lastActionMillis = -1L;

    // --- Derived ---
    private double frequencyBaseline = 1.0;
    private double anomalyScore;
    private double riskScore;
    private BehaviorCategory lastCategory = BehaviorCategory.NORMAL;
    private long lastAnomalyEventMillis = Long.MIN_VALUE;
    private final Map<String, Double> subScores = new LinkedHashMap<>();

    public BehaviorProfile(ScoringConfig config) {
        this.config = Objects.requireNonNull(config, "ScoringConfig must not be null");
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * Record one action invocation.
     *
     * @param actionType action name
     * @param data       free-form payload, may be {@code null}
     * @param nowMillis  observation time
     */
    public void recordAction(String actionType, Map<String, Object> data, long nowMillis) {
        ActionSample sample = new ActionSample(actionType, data, nowMillis);
        if (lastActionMillis >= 0) {
            long interval = nowMillis - lastActionMillis;
            if (interval >= 0 && interval < microRetentionMillis()) {
                append(timingSamples, new TimingSample(interval, nowMillis));
            }
        }
        lastActionMillis = Math.max(lastActionMillis, nowMillis);
        append(actionSamples, sample);
        append(actionHistory, sample);
        touch(nowMillis);
        prune(nowMillis);
    }

    /**
     * Record one movement report.
     *
     * @param position  reported position
     * @param velocity  reported velocity, may be {@code null}
     * @param nowMillis observation time
     */
    public void recordMovement(Vector3 position, Vector3 velocity, long nowMillis) {
        MovementSample sample = new MovementSample(position, velocity, nowMillis);
        append(movementSamples, sample);
        append(movementHistory, sample);
        touch(nowMillis);
        prune(nowMillis);
    }

    /**
     * Drop samples older than their retention windows.
     *
     * @param nowMillis current time
     */
    public void prune(long nowMillis) {
        long microCutoff = nowMillis - microRetentionMillis();
        long macroCutoff = nowMillis - Math.round(config.getMacroRetentionSeconds() * 1_000d);

        while (!actionSamples.isEmpty() && actionSamples.peekFirst().getTimestampMillis() < microCutoff) {
            actionSamples.pollFirst();
        }
        while (!timingSamples.isEmpty() && timingSamples.peekFirst().timestampMillis() < microCutoff) {
            timingSamples.pollFirst();
        }
        while (!movementSamples.isEmpty()
                && movementSamples.peekFirst().getTimestampMillis() < microCutoff) {
            movementSamples.pollFirst();
        }
        while (!actionHistory.isEmpty() && actionHistory.peekFirst().getTimestampMillis() < macroCutoff) {
            actionHistory.pollFirst();
        }
        while (!movementHistory.isEmpty()
                && movementHistory.peekFirst().getTimestampMillis() < macroCutoff) {
            movementHistory.pollFirst();
        }
    }

    // ---------------------------------------------------------------
    // Session tracking
    // ---------------------------------------------------------------

    private void touch(long nowMillis) {
        if (lastActivityMillis < 0) {
            currentSegmentStart = nowMillis;
        } else if (nowMillis - lastActivityMillis > Math.round(config.getSessionIdleGapSeconds() * 1_000d)) {
            sessionSegments.addLast(lastActivityMillis - currentSegmentStart);
            if (sessionSegments.size() > MAX_SESSION_SEGMENTS) {
                sessionSegments.pollFirst();
            }
            currentSegmentStart = nowMillis;
        }
        lastActivityMillis = Math.max(lastActivityMillis, nowMillis);
    }

    /**
     * @return length of the ongoing activity segment in millis, 0 if none
     */
    public long currentSegmentMillis() {
        return lastActivityMillis < 0 ? 0 : lastActivityMillis - currentSegmentStart;
    }

    /**
     * @return lengths of completed activity segments in millis, oldest first
     */
    public List<Long> completedSegments() {
        return Collections.unmodifiableList(new ArrayList<>(sessionSegments));
    }

    /**
     * @return time of the last recorded action or movement, or {@code -1}
     */
    public long getLastActivityMillis() {
        return lastActivityMillis;
    }

    // ---------------------------------------------------------------
    // Buffer views (oldest first)
    // ---------------------------------------------------------------

    public Collection<ActionSample> actionSamples() {
        return Collections.unmodifiableCollection(actionSamples);
    }

    public Collection<TimingSample> timingSamples() {
        return Collections.unmodifiableCollection(timingSamples);
    }

    public Collection<MovementSample> movementSamples() {
        return Collections.unmodifiableCollection(movementSamples);
    }

    public Collection<ActionSample> actionHistory() {
        return Collections.unmodifiableCollection(actionHistory);
    }

    public Collection<MovementSample> movementHistory() {
        return Collections.unmodifiableCollection(movementHistory);
    }

    /**
     * @return samples currently held in the micro buffers
     */
    public int sampleCount() {
        return actionSamples.size() + movementSamples.size();
    }

    // ---------------------------------------------------------------
    // Derived state
    // ---------------------------------------------------------------

    public double getFrequencyBaseline() {
        return frequencyBaseline;
    }

    void setFrequencyBaseline(double frequencyBaseline) {
        this.frequencyBaseline = frequencyBaseline;
    }

    public double getAnomalyScore() {
        return anomalyScore;
    }

    void setAnomalyScore(double anomalyScore) {
        this.anomalyScore = anomalyScore;
    }

    public double getRiskScore() {
        return riskScore;
    }

    void setRiskScore(double riskScore) {
        this.riskScore = riskScore;
    }

    /**
     * @return category assigned at the previous macro tick, used only to
     *         detect transitions
     */
    public BehaviorCategory getLastCategory() {
        return lastCategory;
    }

    public void setLastCategory(BehaviorCategory lastCategory) {
        this.lastCategory = Objects.requireNonNull(lastCategory);
    }

    public long getLastAnomalyEventMillis() {
        return lastAnomalyEventMillis;
    }

    public void setLastAnomalyEventMillis(long lastAnomalyEventMillis) {
        this.lastAnomalyEventMillis = lastAnomalyEventMillis;
    }

    /**
     * @return the most recent per-feature scores, keyed by scorer name
     */
    public Map<String, Double> getSubScores() {
        return Collections.unmodifiableMap(subScores);
    }

    void putSubScore(String scorer, double score) {
        subScores.put(scorer, score);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private long microRetentionMillis() {
        return Math.round(config.getMicroRetentionSeconds() * 1_000d);
    }

    private <T> void append(Deque<T> buffer, T sample) {
        buffer.addLast(sample);
        if (buffer.size() > config.getMaxBufferSize()) {
            buffer.pollFirst();
        }
    }

    /**
     * Gap between two consecutive actions, stamped with the later action's time.
     */
    public static final class TimingSample {

        private final long intervalMillis;
        private final long timestampMillis;

        public TimingSample(long intervalMillis, long timestampMillis) {
            this.intervalMillis = intervalMillis;
            this.timestampMillis = timestampMillis;
        }

        public long intervalMillis() {
            return intervalMillis;
        }

        public long timestampMillis() {
            return timestampMillis;
        }
    }
}
