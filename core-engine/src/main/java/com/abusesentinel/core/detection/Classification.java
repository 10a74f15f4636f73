package com.abusesentinel.core.detection;

import com.abusesentinel.core.model.BehaviorCategory;

import java.util.Objects;

/**
 * Result of classifying a (risk, anomaly) pair.
 */
public final class Classification {

    private final BehaviorCategory category;
    private final double confidence;
    private final double combined;

    Classification(BehaviorCategory category, double confidence, double combined) {
        this.category = Objects.requireNonNull(category);
        this.confidence = confidence;
        this.combined = combined;
    }

    public BehaviorCategory getCategory() {
        return category;
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * @return mean of the risk and anomaly scores the category was derived from
     */
    public double getCombined() {
        return combined;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Classification that)) {
            return false;
        }
        return category == that.category
                && Double.compare(confidence, that.confidence) == 0
                && Double.compare(combined, that.combined) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, confidence, combined);
    }

    @Override
    public String toString() {
        return "Classification{category=" + category + ", confidence=" + confidence
                + ", combined=" + combined + '}';
    }
}
