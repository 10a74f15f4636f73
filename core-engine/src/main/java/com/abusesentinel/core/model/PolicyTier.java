package com.abusesentinel.core.model;

import java.util.Locale;

/**
 * Limit tiers an endpoint can be assigned to, from tightest to loosest.
 *
 * <p>
 * {@link #PRIVILEGED} is never assigned to an endpoint directly. It overrides
 * the endpoint's tier when the calling subject is privileged.
 * </p>
 *
 * @since 1.0.0
 */
public enum PolicyTier {

    CRITICAL,
    STANDARD,
    HIGH_FREQUENCY,
    PRIVILEGED;

    /**
     * Return the lowercase configuration name of this tier (e.g.
     * {@code high_frequency}).
     *
     * @return configuration name
     */
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a tier from its configuration name, ignoring case.
     *
     * @param name the configuration name; must not be {@code null}
     * @return the matching tier
     * @throws IllegalArgumentException if no tier has that name
     */
    public static PolicyTier fromConfigName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tier name must not be null or blank");
        }
        String normalised = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (PolicyTier tier : values()) {
            if (tier.name().equals(normalised)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown tier: '" + name
                + "'. Supported: critical, standard, high_frequency, privileged");
    }
}
