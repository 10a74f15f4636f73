package com.abusesentinel.core.model;

import java.util.Objects;

/**
 * Immutable limit profile applied to requests against one endpoint.
 *
 * <p>
 * Durations are fractional seconds because an adaptive multiplier can stretch
 * a whole-second window into a fractional one.
 * </p>
 *
 * @since 1.0.0
 */
public final class EndpointPolicy {

    private final String tierName;
    private final int maxRequests;
    private final double windowSeconds;
    private final int burstLimit;
    private final double cooldownSeconds;

    /**
     * @param tierName        tier this policy belongs to
     * @param maxRequests     requests allowed per window, at least 1
     * @param windowSeconds   window length, strictly positive
     * @param burstLimit      requests allowed per second, at least 1
     * @param cooldownSeconds minimum gap between requests, 0 disables it
     * @throws NullPointerException     if {@code tierName} is {@code null}
     * @throws IllegalArgumentException if any limit is out of range
     */
    public EndpointPolicy(String tierName, int maxRequests, double windowSeconds,
            int burstLimit, double cooldownSeconds) {
        this.tierName = Objects.requireNonNull(tierName, "tierName must not be null");
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1, got: " + maxRequests);
        }
        if (!(windowSeconds > 0)) {
            throw new IllegalArgumentException("windowSeconds must be > 0, got: " + windowSeconds);
        }
        if (burstLimit < 1) {
            throw new IllegalArgumentException("burstLimit must be >= 1, got: " + burstLimit);
        }
        if (cooldownSeconds < 0) {
            throw new IllegalArgumentException(
                    "cooldownSeconds must be >= 0, got: " + cooldownSeconds);
        }
        this.maxRequests = maxRequests;
        this.windowSeconds = windowSeconds;
        this.burstLimit = burstLimit;
        this.cooldownSeconds = cooldownSeconds;
    }

    public String getTierName() {
        return tierName;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public double getWindowSeconds() {
        return windowSeconds;
    }

    public int getBurstLimit() {
        return burstLimit;
    }

    public double getCooldownSeconds() {
        return cooldownSeconds;
    }

    public long windowMillis() {
        return Math.round(windowSeconds * 1_000d);
    }

    public long cooldownMillis() {
        return Math.round(cooldownSeconds * 1_000d);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EndpointPolicy that))
            return false;
        return maxRequests == that.maxRequests
                && Double.compare(windowSeconds, that.windowSeconds) == 0
                && burstLimit == that.burstLimit
                && Double.compare(cooldownSeconds, that.cooldownSeconds) == 0
                && tierName.equals(that.tierName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tierName, maxRequests, windowSeconds, burstLimit, cooldownSeconds);
    }

    @Override
    public String toString() {
        return "EndpointPolicy{" +
                "tierName='" + tierName + '\'' +
                ", maxRequests=" + maxRequests +
                ", windowSeconds=" + windowSeconds +
                ", burstLimit=" + burstLimit +
                ", cooldownSeconds=" + cooldownSeconds +
                '}';
    }
}
