package com.abusesentinel.core.model;

/**
 * Per-subject adaptive throttle state.
 *
 * <p>
 * {@code throttleMultiplier} never drops below 1.0 and {@code trustScore}
 * stays inside {@code [minTrust, 1.0]}. The two always move in opposite
 * directions: escalation raises the multiplier and lowers trust, decay does
 * the reverse.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. Only the owning subject's violation and decay logic may
 * mutate an instance. Readers outside the engine get a {@link Snapshot}.
 * </p>
 *
 * @since 1.0.0
 */
public class AdaptiveState {

    public static final double NEUTRAL_MULTIPLIER = 1.0;
    public static final double FULL_TRUST = 1.0;

    private int violationCount;
    private double throttleMultiplier = NEUTRAL_MULTIPLIER;
    private double trustScore = FULL_TRUST;
    private long lastViolationMillis = -1L;

    public int getViolationCount() {
        return violationCount;
    }

    public void setViolationCount(int violationCount) {
        this.violationCount = violationCount;
    }

    public double getThrottleMultiplier() {
        return throttleMultiplier;
    }

    public void setThrottleMultiplier(double throttleMultiplier) {
        this.throttleMultiplier = Math.max(NEUTRAL_MULTIPLIER, throttleMultiplier);
    }

    public double getTrustScore() {
        return trustScore;
    }

    public void setTrustScore(double trustScore) {
        this.trustScore = Math.min(FULL_TRUST, trustScore);
    }

    /**
     * @return time of the last violation in millis, or {@code -1} if the
     *         subject never violated
     */
    public long getLastViolationMillis() {
        return lastViolationMillis;
    }

    public void setLastViolationMillis(long lastViolationMillis) {
        this.lastViolationMillis = lastViolationMillis;
    }

    public boolean hasViolated() {
        return lastViolationMillis >= 0;
    }

    /**
     * Return the state to its neutral values.
     */
    public void reset() {
        violationCount = 0;
        throttleMultiplier = NEUTRAL_MULTIPLIER;
        trustScore = FULL_TRUST;
    }

    public Snapshot snapshot() {
        return new Snapshot(violationCount, throttleMultiplier, trustScore, lastViolationMillis);
    }

    @Override
    public String toString() {
        return "AdaptiveState{" +
                "violationCount=" + violationCount +
                ", throttleMultiplier=" + throttleMultiplier +
                ", trustScore=" + trustScore +
                ", lastViolationMillis=" + lastViolationMillis +
                '}';
    }

    /**
     * Immutable, read-only view of an {@link AdaptiveState}.
     */
    public static final class Snapshot {

        private static final Snapshot NEUTRAL = new Snapshot(0, NEUTRAL_MULTIPLIER, FULL_TRUST, -1L);

        private final int violationCount;
        private final double throttleMultiplier;
        private final double trustScore;
        private final long lastViolationMillis;

        private Snapshot(int violationCount, double throttleMultiplier, double trustScore,
                long lastViolationMillis) {
            this.violationCount = violationCount;
            this.throttleMultiplier = throttleMultiplier;
            this.trustScore = trustScore;
            this.lastViolationMillis = lastViolationMillis;
        }

        /**
         * @return the snapshot of a subject that has never been seen
         */
        public static Snapshot neutral() {
            return NEUTRAL;
        }

        public int getViolationCount() {
            return violationCount;
        }

        public double getThrottleMultiplier() {
            return throttleMultiplier;
        }

        public double getTrustScore() {
            return trustScore;
        }

        public long getLastViolationMillis() {
            return lastViolationMillis;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Snapshot that))
                return false;
            return violationCount == that.violationCount
                    && Double.compare(throttleMultiplier, that.throttleMultiplier) == 0
                    && Double.compare(trustScore, that.trustScore) == 0
                    && lastViolationMillis == that.lastViolationMillis;
        }

        @Override
        public int hashCode() {
            return java.util.Objects.hash(violationCount, throttleMultiplier, trustScore,
                    lastViolationMillis);
        }

        @Override
        public String toString() {
            return "AdaptiveState.Snapshot{" +
                    "violationCount=" + violationCount +
                    ", throttleMultiplier=" + throttleMultiplier +
                    ", trustScore=" + trustScore +
                    '}';
        }
    }
}
