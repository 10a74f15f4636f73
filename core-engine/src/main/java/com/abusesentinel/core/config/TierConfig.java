package com.abusesentinel.core.config;

import com.abusesentinel.core.model.EndpointPolicy;
import com.abusesentinel.core.model.PolicyTier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One limit tier as declared in configuration, together with the endpoints
 * assigned to it.
 *
 * <pre>
 * tiers:
 *   - name: critical
 *     maxRequests: 5
 *     windowSeconds: 60
 *     burstLimit: 2
 *     cooldownSeconds: 2.0
 *     endpoints: [PurchaseItem, BuyItem]
 * </pre>
 *
 * @since 1.0.0
 */
public class TierConfig {

    /** Tier name: critical, standard, high_frequency or privileged. */
    private String name;

    private int maxRequests;
    private double windowSeconds;
    private int burstLimit;
    private double cooldownSeconds;

    /** Endpoint names using this tier. Must be empty for the privileged tier. */
    private List<String> endpoints = new ArrayList<>();

    public TierConfig() {
    }

    public TierConfig(String name, int maxRequests, double windowSeconds, int burstLimit,
            double cooldownSeconds, List<String> endpoints) {
        this.name = name;
        this.maxRequests = maxRequests;
        this.windowSeconds = windowSeconds;
        this.burstLimit = burstLimit;
        this.cooldownSeconds = cooldownSeconds;
        setEndpoints(endpoints);
    }

    /**
     * Collect problems with this tier into {@code errors}.
     *
     * @param errors sink for validation messages
     */
    void validate(List<String> errors) {
        if (name == null || name.isBlank()) {
            errors.add("Tier 'name' is required");
            return;
        }
        PolicyTier tier;
        try {
            tier = PolicyTier.fromConfigName(name);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
            return;
        }
        if (maxRequests < 1) {
            errors.add("Tier '" + name + "' requires 'maxRequests' >= 1");
        }
        if (!(windowSeconds > 0)) {
            errors.add("Tier '" + name + "' requires 'windowSeconds' > 0");
        }
        if (burstLimit < 1) {
            errors.add("Tier '" + name + "' requires 'burstLimit' >= 1");
        }
        if (cooldownSeconds < 0) {
            errors.add("Tier '" + name + "' requires 'cooldownSeconds' >= 0");
        }
        if (tier == PolicyTier.PRIVILEGED && !endpoints.isEmpty()) {
            errors.add("Tier 'privileged' is an override tier and cannot list endpoints");
        }
        for (String endpoint : endpoints) {
            if (endpoint == null || endpoint.isBlank()) {
                errors.add("Tier '" + name + "' lists a blank endpoint name");
            }
        }
    }

    public PolicyTier tier() {
        return PolicyTier.fromConfigName(name);
    }

    public EndpointPolicy toPolicy() {
        return new EndpointPolicy(tier().configName(), maxRequests, windowSeconds, burstLimit,
                cooldownSeconds);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public void setMaxRequests(int maxRequests) {
        this.maxRequests = maxRequests;
    }

    public double getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(double windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public int getBurstLimit() {
        return burstLimit;
    }

    public void setBurstLimit(int burstLimit) {
        this.burstLimit = burstLimit;
    }

    public double getCooldownSeconds() {
        return cooldownSeconds;
    }

    public void setCooldownSeconds(double cooldownSeconds) {
        this.cooldownSeconds = cooldownSeconds;
    }

    public List<String> getEndpoints() {
        return Collections.unmodifiableList(endpoints);
    }

    public void setEndpoints(List<String> endpoints) {
        this.endpoints = endpoints != null ? new ArrayList<>(endpoints) : new ArrayList<>();
    }

    TierConfig copy() {
        TierConfig copy = new TierConfig();
        copy.name = name;
        copy.maxRequests = maxRequests;
        copy.windowSeconds = windowSeconds;
        copy.burstLimit = burstLimit;
        copy.cooldownSeconds = cooldownSeconds;
        copy.endpoints = new ArrayList<>(endpoints);
        return copy;
    }

    @Override
    public String toString() {
        return "TierConfig{" +
                "name='" + name + '\'' +
                ", maxRequests=" + maxRequests +
                ", windowSeconds=" + windowSeconds +
                ", burstLimit=" + burstLimit +
                ", cooldownSeconds=" + cooldownSeconds +
                ", endpoints=" + endpoints +
                '}';
    }
}
