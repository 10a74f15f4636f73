package com.abusesentinel.core.config;

import java.util.List;

/**
 * Behavior scoring parameters: buffer retention, feature thresholds and the
 * anomaly event trigger.
 *
 * @since 1.0.0
 */
public class ScoringConfig {

    // --- Buffers ---
    /** Samples required before any scorer produces a non-zero score. */
    private int minSamples = 10;
    private double microRetentionSeconds = 60;
    private double macroRetentionSeconds = 1800;
    private int maxBufferSize = 2000;

    private FeatureWeights weights = new FeatureWeights();

    // --- Anomaly events ---
    private double anomalyEventThreshold = 0.7;
    private double anomalyEventCooldownSeconds = 10;

    // --- Action frequency ---
    private double frequencyMultiple = 5.0;
    /** Interval variance (seconds squared) below which timing is machine-regular. */
    private double timingVarianceEpsilon = 0.001;
    private int ngramSize = 3;
    private int ngramRepeatThreshold = 5;

    // --- Timing consistency ---
    private double lowCvThreshold = 0.1;
    private double highCvThreshold = 2.0;

    // --- Movement ---
    /** Physical speed cap in world units per second. */
    private double maxSpeed = 100.0;
    private int directionWindow = 4;
    private int directionRepeatThreshold = 3;

    // --- Risk ---
    private double violationRiskWeight = 0.05;
    private double violationRiskCap = 0.3;
    private double violationRiskWindowSeconds = 300;
    private double sessionIdleGapSeconds = 300;

    void validate(List<String> errors) {
        if (minSamples < 2) {
            errors.add("scoring.minSamples must be >= 2");
        }
        if (!(microRetentionSeconds > 0)) {
            errors.add("scoring.microRetentionSeconds must be > 0");
        }
        if (macroRetentionSeconds < microRetentionSeconds) {
            errors.add("scoring.macroRetentionSeconds must be >= microRetentionSeconds");
        }
        if (maxBufferSize < minSamples) {
            errors.add("scoring.maxBufferSize must be >= minSamples");
        }
        if (weights == null) {
            errors.add("scoring.weights must not be null");
        } else {
            weights.validate(errors);
        }
        if (!(anomalyEventThreshold > 0 && anomalyEventThreshold <= 1)) {
            errors.add("scoring.anomalyEventThreshold must be in (0, 1]");
        }
        if (anomalyEventCooldownSeconds < 0) {
            errors.add("scoring.anomalyEventCooldownSeconds must be >= 0");
        }
        if (!(frequencyMultiple > 1)) {
            errors.add("scoring.frequencyMultiple must be > 1");
        }
        if (!(timingVarianceEpsilon > 0)) {
            errors.add("scoring.timingVarianceEpsilon must be > 0");
        }
        if (ngramSize < 2) {
            errors.add("scoring.ngramSize must be >= 2");
        }
        if (ngramRepeatThreshold < 1) {
            errors.add("scoring.ngramRepeatThreshold must be >= 1");
        }
        if (!(lowCvThreshold > 0) || highCvThreshold <= lowCvThreshold) {
            errors.add("scoring.lowCvThreshold must be > 0 and below highCvThreshold");
        }
        if (!(maxSpeed > 0)) {
            errors.add("scoring.maxSpeed must be > 0");
        }
        if (directionWindow < 2) {
            errors.add("scoring.directionWindow must be >= 2");
        }
        if (directionRepeatThreshold < 1) {
            errors.add("scoring.directionRepeatThreshold must be >= 1");
        }
        if (violationRiskWeight < 0 || violationRiskCap < 0 || violationRiskCap > 1) {
            errors.add("scoring.violationRiskWeight must be >= 0 and violationRiskCap in [0, 1]");
        }
        if (!(violationRiskWindowSeconds > 0)) {
            errors.add("scoring.violationRiskWindowSeconds must be > 0");
        }
        if (!(sessionIdleGapSeconds > 0)) {
            errors.add("scoring.sessionIdleGapSeconds must be > 0");
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public double getMicroRetentionSeconds() {
        return microRetentionSeconds;
    }

    public void setMicroRetentionSeconds(double microRetentionSeconds) {
        this.microRetentionSeconds = microRetentionSeconds;
    }

    public double getMacroRetentionSeconds() {
        return macroRetentionSeconds;
    }

    public void setMacroRetentionSeconds(double macroRetentionSeconds) {
        this.macroRetentionSeconds = macroRetentionSeconds;
    }

    public int getMaxBufferSize() {
        return maxBufferSize;
    }

    public void setMaxBufferSize(int maxBufferSize) {
        this.maxBufferSize = maxBufferSize;
    }

    public FeatureWeights getWeights() {
        return weights;
    }

    public void setWeights(FeatureWeights weights) {
        this.weights = weights;
    }

    public double getAnomalyEventThreshold() {
        return anomalyEventThreshold;
    }

    public void setAnomalyEventThreshold(double anomalyEventThreshold) {
        this.anomalyEventThreshold = anomalyEventThreshold;
    }

    public double getAnomalyEventCooldownSeconds() {
        return anomalyEventCooldownSeconds;
    }

    public void setAnomalyEventCooldownSeconds(double anomalyEventCooldownSeconds) {
        this.anomalyEventCooldownSeconds = anomalyEventCooldownSeconds;
    }

    public double getFrequencyMultiple() {
        return frequencyMultiple;
    }

    public void setFrequencyMultiple(double frequencyMultiple) {
        this.frequencyMultiple = frequencyMultiple;
    }

    public double getTimingVarianceEpsilon() {
        return timingVarianceEpsilon;
    }

    public void setTimingVarianceEpsilon(double timingVarianceEpsilon) {
        this.timingVarianceEpsilon = timingVarianceEpsilon;
    }

    public int getNgramSize() {
        return ngramSize;
    }

    public void setNgramSize(int ngramSize) {
        this.ngramSize = ngramSize;
    }

    public int getNgramRepeatThreshold() {
        return ngramRepeatThreshold;
    }

    public void setNgramRepeatThreshold(int ngramRepeatThreshold) {
        this.ngramRepeatThreshold = ngramRepeatThreshold;
    }

    public double getLowCvThreshold() {
        return lowCvThreshold;
    }

    public void setLowCvThreshold(double lowCvThreshold) {
        this.lowCvThreshold = lowCvThreshold;
    }

    public double getHighCvThreshold() {
        return highCvThreshold;
    }

    public void setHighCvThreshold(double highCvThreshold) {
        this.highCvThreshold = highCvThreshold;
    }

    public double getMaxSpeed() {
        return maxSpeed;
    }

    public void setMaxSpeed(double maxSpeed) {
        this.maxSpeed = maxSpeed;
    }

    public int getDirectionWindow() {
        return directionWindow;
    }

    public void setDirectionWindow(int directionWindow) {
        this.directionWindow = directionWindow;
    }

    public int getDirectionRepeatThreshold() {
        return directionRepeatThreshold;
    }

    public void setDirectionRepeatThreshold(int directionRepeatThreshold) {
        this.directionRepeatThreshold = directionRepeatThreshold;
    }

    public double getViolationRiskWeight() {
        return violationRiskWeight;
    }

    public void setViolationRiskWeight(double violationRiskWeight) {
        this.violationRiskWeight = violationRiskWeight;
    }

    public double getViolationRiskCap() {
        return violationRiskCap;
    }

    public void setViolationRiskCap(double violationRiskCap) {
        this.violationRiskCap = violationRiskCap;
    }

    public double getViolationRiskWindowSeconds() {
        return violationRiskWindowSeconds;
    }

    public void setViolationRiskWindowSeconds(double violationRiskWindowSeconds) {
        this.violationRiskWindowSeconds = violationRiskWindowSeconds;
    }

    public double getSessionIdleGapSeconds() {
        return sessionIdleGapSeconds;
    }

    public void setSessionIdleGapSeconds(double sessionIdleGapSeconds) {
        this.sessionIdleGapSeconds = sessionIdleGapSeconds;
    }

    ScoringConfig copy() {
        ScoringConfig copy = new ScoringConfig();
        copy.minSamples = minSamples;
        copy.microRetentionSeconds = microRetentionSeconds;
        copy.macroRetentionSeconds = macroRetentionSeconds;
        copy.maxBufferSize = maxBufferSize;
        copy.weights = weights != null ? weights.copy() : null;
        copy.anomalyEventThreshold = anomalyEventThreshold;
        copy.anomalyEventCooldownSeconds = anomalyEventCooldownSeconds;
        copy.frequencyMultiple = frequencyMultiple;
        copy.timingVarianceEpsilon = timingVarianceEpsilon;
        copy.ngramSize = ngramSize;
        copy.ngramRepeatThreshold = ngramRepeatThreshold;
        copy.lowCvThreshold = lowCvThreshold;
        copy.highCvThreshold = highCvThreshold;
        copy.maxSpeed = maxSpeed;
        copy.directionWindow = directionWindow;
        copy.directionRepeatThreshold = directionRepeatThreshold;
        copy.violationRiskWeight = violationRiskWeight;
        copy.violationRiskCap = violationRiskCap;
        copy.violationRiskWindowSeconds = violationRiskWindowSeconds;
        copy.sessionIdleGapSeconds = sessionIdleGapSeconds;
        return copy;
    }

    @Override
    public String toString() {
        return "ScoringConfig{" +
                "minSamples=" + minSamples +
                ", microRetentionSeconds=" + microRetentionSeconds +
                ", macroRetentionSeconds=" + macroRetentionSeconds +
                ", weights=" + weights +
                ", anomalyEventThreshold=" + anomalyEventThreshold +
                '}';
    }
}
