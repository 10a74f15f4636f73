package com.abusesentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Event emitted to the notification/audit collaborator when a subject's
 * behavior crosses an anomaly threshold.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code subjectId}, {@code source} and
 * {@code timestamp} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyEvent {

    /** Cadence that raised the event. */
    public enum Source {
        /** Fast per-tick feature scoring crossed the hard threshold. */
        MICRO,
        /** Slow classification moved the subject into a worse category. */
        MACRO
    }

    private final String subjectId;
    private final double score;
    private final String details;
    private final Source source;
    private final BehaviorCategory category;
    private final Instant timestamp;
    private final Map<String, Double> subScores;

    private AnomalyEvent(Builder builder) {
        this.subjectId = Objects.requireNonNull(builder.subjectId, "subjectId must not be null");
        this.source = Objects.requireNonNull(builder.source, "source must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.score = builder.score;
        this.details = builder.details != null ? builder.details : "";
        this.category = builder.category != null ? builder.category : BehaviorCategory.NORMAL;
        this.subScores = builder.subScores != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.subScores))
                : Collections.emptyMap();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyEvent} instances.
     */
    public static class Builder {
        private String subjectId;
        private double score;
        private String details;
        private Source source;
        private BehaviorCategory category;
        private Instant timestamp;
        private Map<String, Double> subScores;

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        public Builder source(Source source) {
            this.source = source;
            return this;
        }

        public Builder category(BehaviorCategory category) {
            this.category = category;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder subScores(Map<String, Double> subScores) {
            this.subScores = subScores;
            return this;
        }

        public AnomalyEvent build() {
            return new AnomalyEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getSubjectId() {
        return subjectId;
    }

    public double getScore() {
        return score;
    }

    public String getDetails() {
        return details;
    }

    public Source getSource() {
        return source;
    }

    public BehaviorCategory getCategory() {
        return category;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Double> getSubScores() {
        return subScores;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyEvent that))
            return false;
        return subjectId.equals(that.subjectId)
                && source == that.source
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjectId, source, timestamp);
    }

    @Override
    public String toString() {
        return "AnomalyEvent{" +
                "subjectId='" + subjectId + '\'' +
                ", source=" + source +
                ", score=" + score +
                ", category=" + category +
                ", timestamp=" + timestamp +
                ", details='" + details + '\'' +
                '}';
    }
}
