package com.abusesentinel.core.model;

import java.util.Objects;

/**
 * Read-only snapshot of a subject's behavioral scores, as returned to
 * observability and UI collaborators.
 *
 * @since 1.0.0
 */
public final class BehaviorAnalysis {

    private final String subjectId;
    private final double riskScore;
    private final double anomalyScore;
    private final BehaviorCategory behaviorCategory;
    private final double confidence;
    private final int sampleCount;

    public BehaviorAnalysis(String subjectId, double riskScore, double anomalyScore,
            BehaviorCategory behaviorCategory, double confidence, int sampleCount) {
        this.subjectId = Objects.requireNonNull(subjectId, "subjectId must not be null");
        this.riskScore = riskScore;
        this.anomalyScore = anomalyScore;
        this.behaviorCategory = Objects.requireNonNull(behaviorCategory,
                "behaviorCategory must not be null");
        this.confidence = confidence;
        this.sampleCount = sampleCount;
    }

    /**
     * Analysis of a subject with no recorded activity.
     *
     * @param subjectId the subject
     * @return zero scores, {@link BehaviorCategory#NORMAL}, full confidence
     */
    public static BehaviorAnalysis fresh(String subjectId) {
        return new BehaviorAnalysis(subjectId, 0.0, 0.0, BehaviorCategory.NORMAL, 1.0, 0);
    }

    public String getSubjectId() {
        return subjectId;
    }

    public double getRiskScore() {
        return riskScore;
    }

    public double getAnomalyScore() {
        return anomalyScore;
    }

    public BehaviorCategory getBehaviorCategory() {
        return behaviorCategory;
    }

    public double getConfidence() {
        return confidence;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BehaviorAnalysis that))
            return false;
        return Double.compare(riskScore, that.riskScore) == 0
                && Double.compare(anomalyScore, that.anomalyScore) == 0
                && Double.compare(confidence, that.confidence) == 0
                && sampleCount == that.sampleCount
                && subjectId.equals(that.subjectId)
                && behaviorCategory == that.behaviorCategory;
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjectId, riskScore, anomalyScore, behaviorCategory, confidence,
                sampleCount);
    }

    @Override
    public String toString() {
        return "BehaviorAnalysis{" +
                "subjectId='" + subjectId + '\'' +
                ", riskScore=" + riskScore +
                ", anomalyScore=" + anomalyScore +
                ", behaviorCategory=" + behaviorCategory +
                ", confidence=" + confidence +
                ", sampleCount=" + sampleCount +
                '}';
    }
}
