package com.abusesentinel.core.config;

import java.util.List;

/**
 * Adaptive throttle escalation and recovery parameters.
 *
 * @since 1.0.0
 */
public class ThrottleConfig {

    /** Violations tolerated before the multiplier starts escalating. */
    private int violationThreshold = 3;

    private double escalationFactor = 1.5;
    private double maxMultiplier = 5.0;
    private double trustDecayFactor = 0.8;
    private double minTrust = 0.1;

    /** Violation-free time required before any recovery step. */
    private double quietPeriodSeconds = 120;

    private double relaxFactor = 0.9;
    private double trustRecoveryFactor = 1.1;

    /** Multiplier below which the state snaps back to neutral. */
    private double resetCutoff = 1.05;

    private double violationRetentionSeconds = 3600;

    void validate(List<String> errors) {
        if (violationThreshold < 1) {
            errors.add("throttle.violationThreshold must be >= 1");
        }
        if (!(escalationFactor > 1)) {
            errors.add("throttle.escalationFactor must be > 1");
        }
        if (maxMultiplier < 1) {
            errors.add("throttle.maxMultiplier must be >= 1");
        }
        if (!(trustDecayFactor > 0 && trustDecayFactor < 1)) {
            errors.add("throttle.trustDecayFactor must be in (0, 1)");
        }
        if (!(minTrust > 0 && minTrust <= 1)) {
            errors.add("throttle.minTrust must be in (0, 1]");
        }
        if (!(quietPeriodSeconds > 0)) {
            errors.add("throttle.quietPeriodSeconds must be > 0");
        }
        if (!(relaxFactor > 0 && relaxFactor < 1)) {
            errors.add("throttle.relaxFactor must be in (0, 1)");
        }
        if (!(trustRecoveryFactor > 1)) {
            errors.add("throttle.trustRecoveryFactor must be > 1");
        }
        if (resetCutoff < 1) {
            errors.add("throttle.resetCutoff must be >= 1");
        }
        if (!(violationRetentionSeconds > 0)) {
            errors.add("throttle.violationRetentionSeconds must be > 0");
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getViolationThreshold() {
        return violationThreshold;
    }

    public void setViolationThreshold(int violationThreshold) {
        this.violationThreshold = violationThreshold;
    }

    public double getEscalationFactor() {
        return escalationFactor;
    }

    public void setEscalationFactor(double escalationFactor) {
        this.escalationFactor = escalationFactor;
    }

    public double getMaxMultiplier() {
        return maxMultiplier;
    }

    public void setMaxMultiplier(double maxMultiplier) {
        this.maxMultiplier = maxMultiplier;
    }

    public double getTrustDecayFactor() {
        return trustDecayFactor;
    }

    public void setTrustDecayFactor(double trustDecayFactor) {
        this.trustDecayFactor = trustDecayFactor;
    }

    public double getMinTrust() {
        return minTrust;
    }

    public void setMinTrust(double minTrust) {
        this.minTrust = minTrust;
    }

    public double getQuietPeriodSeconds() {
        return quietPeriodSeconds;
    }

    public void setQuietPeriodSeconds(double quietPeriodSeconds) {
        this.quietPeriodSeconds = quietPeriodSeconds;
    }

    public double getRelaxFactor() {
        return relaxFactor;
    }

    public void setRelaxFactor(double relaxFactor) {
        this.relaxFactor = relaxFactor;
    }

    public double getTrustRecoveryFactor() {
        return trustRecoveryFactor;
    }

    public void setTrustRecoveryFactor(double trustRecoveryFactor) {
        this.trustRecoveryFactor = trustRecoveryFactor;
    }

    public double getResetCutoff() {
        return resetCutoff;
    }

    public void setResetCutoff(double resetCutoff) {
        this.resetCutoff = resetCutoff;
    }

    public double getViolationRetentionSeconds() {
        return violationRetentionSeconds;
    }

    public void setViolationRetentionSeconds(double violationRetentionSeconds) {
        this.violationRetentionSeconds = violationRetentionSeconds;
    }

    ThrottleConfig copy() {
        ThrottleConfig copy = new ThrottleConfig();
        copy.violationThreshold = violationThreshold;
        copy.escalationFactor = escalationFactor;
        copy.maxMultiplier = maxMultiplier;
        copy.trustDecayFactor = trustDecayFactor;
        copy.minTrust = minTrust;
        copy.quietPeriodSeconds = quietPeriodSeconds;
        copy.relaxFactor = relaxFactor;
        copy.trustRecoveryFactor = trustRecoveryFactor;
        copy.resetCutoff = resetCutoff;
        copy.violationRetentionSeconds = violationRetentionSeconds;
        return copy;
    }

    @Override
    public String toString() {
        return "ThrottleConfig{" +
                "violationThreshold=" + violationThreshold +
                ", escalationFactor=" + escalationFactor +
                ", maxMultiplier=" + maxMultiplier +
                ", trustDecayFactor=" + trustDecayFactor +
                ", minTrust=" + minTrust +
                ", quietPeriodSeconds=" + quietPeriodSeconds +
                ", relaxFactor=" + relaxFactor +
                ", resetCutoff=" + resetCutoff +
                '}';
    }
}
