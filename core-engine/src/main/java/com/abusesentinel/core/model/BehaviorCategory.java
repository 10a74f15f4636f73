package com.abusesentinel.core.model;

/**
 * Ordered trust classification of a subject, least to most severe.
 *
 * <p>
 * A category is always derived from the scores that produced it and is never
 * set by hand.
 * </p>
 *
 * @since 1.0.0
 */
public enum BehaviorCategory {

    NORMAL,
    SUSPICIOUS,
    BOT_LIKE,
    EXPLOIT_ATTEMPT,
    ADVANCED_EXPLOIT;

    /**
     * @param other category to compare against
     * @return {@code true} if this category is as severe as {@code other} or
     *         more
     */
    public boolean isAtLeast(BehaviorCategory other) {
        return compareTo(other) >= 0;
    }
}
