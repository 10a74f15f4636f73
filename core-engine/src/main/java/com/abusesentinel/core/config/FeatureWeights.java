package com.abusesentinel.core.config;

import java.util.List;

/**
 * Relative weights of the feature scorers.
 *
 * <p>
 * The micro group (action, timing, movement) forms the anomaly score; the
 * macro group (session, sequence, velocity) forms the risk score. Each group
 * is normalised by its own sum, so only the ratios inside a group matter.
 * </p>
 *
 * @since 1.0.0
 */
public class FeatureWeights {

    private double action = 0.25;
    private double timing = 0.20;
    private double movement = 0.15;
    private double session = 0.05;
    private double sequence = 0.15;
    private double velocity = 0.10;

    void validate(List<String> errors) {
        double[] all = { action, timing, movement, session, sequence, velocity };
        for (double w : all) {
            if (w < 0 || !Double.isFinite(w)) {
                errors.add("scoring.weights must all be finite and >= 0");
                return;
            }
        }
        if (microTotal() <= 0) {
            errors.add("scoring.weights action + timing + movement must be > 0");
        }
        if (macroTotal() <= 0) {
            errors.add("scoring.weights session + sequence + velocity must be > 0");
        }
    }

    public double microTotal() {
        return action + timing + movement;
    }

    public double macroTotal() {
        return session + sequence + velocity;
    }

    /**
     * @param scorer scorer name, as returned by {@code FeatureScorer.name()}
     * @return the weight configured for that scorer
     * @throws IllegalArgumentException if the name is unknown
     */
    public double weightOf(String scorer) {
        return switch (scorer) {
            case "action" -> action;
            case "timing" -> timing;
            case "movement" -> movement;
            case "session" -> session;
            case "sequence" -> sequence;
            case "velocity" -> velocity;
            default -> throw new IllegalArgumentException("Unknown scorer: '" + scorer + "'");
        };
    }

    public double getAction() {
        return action;
    }

    public void setAction(double action) {
        this.action = action;
    }

    public double getTiming() {
        return timing;
    }

    public void setTiming(double timing) {
        this.timing = timing;
    }

    public double getMovement() {
        return movement;
    }

    public void setMovement(double movement) {
        this.movement = movement;
    }

    public double getSession() {
        return session;
    }

    public void setSession(double session) {
        this.session = session;
    }

    public double getSequence() {
        return sequence;
    }

    public void setSequence(double sequence) {
        this.sequence = sequence;
    }

    public double getVelocity() {
        return velocity;
    }

    public void setVelocity(double velocity) {
        this.velocity = velocity;
    }

    FeatureWeights copy() {
        FeatureWeights copy = new FeatureWeights();
        copy.action = action;
        copy.timing = timing;
        copy.movement = movement;
        copy.session = session;
        copy.sequence = sequence;
        copy.velocity = velocity;
        return copy;
    }

    @Override
    public String toString() {
        return "FeatureWeights{" +
                "action=" + action +
                ", timing=" + timing +
                ", movement=" + movement +
                ", session=" + session +
                ", sequence=" + sequence +
                ", velocity=" + velocity +
                '}';
    }
}
