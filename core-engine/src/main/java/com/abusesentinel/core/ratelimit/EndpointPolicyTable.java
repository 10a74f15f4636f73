package com.abusesentinel.core.ratelimit;

import com.abusesentinel.core.config.EngineConfig;
import com.abusesentinel.core.config.TierConfig;
import com.abusesentinel.core.model.EndpointPolicy;
import com.abusesentinel.core.model.PolicyTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Static mapping from endpoint name to limit tier.
 *
 * <p>
 * Built once from configuration and never mutated, so one instance is shared
 * by every subject. Unknown endpoints fall back to
 * {@link PolicyTier#STANDARD}; privileged subjects always get
 * {@link PolicyTier#PRIVILEGED} regardless of the endpoint.
 * </p>
 *
 * @since 1.0.0
 */
public final class EndpointPolicyTable {

    private static final Logger LOG = LoggerFactory.getLogger(EndpointPolicyTable.class);

    private final Map<PolicyTier, EndpointPolicy> policies;
    private final Map<String, PolicyTier> endpointTiers;

    private EndpointPolicyTable(Map<PolicyTier, EndpointPolicy> policies,
            Map<String, PolicyTier> endpointTiers) {
        this.policies = Collections.unmodifiableMap(policies);
        this.endpointTiers = Collections.unmodifiableMap(endpointTiers);
    }

    /**
     * Build the table from a validated configuration.
     *
     * @param config engine configuration; must not be {@code null}
     * @return the policy table
     * @throws IllegalStateException if a tier is missing
     */
    public static EndpointPolicyTable fromConfig(EngineConfig config) {
        Objects.requireNonNull(config, "EngineConfig must not be null");

        Map<PolicyTier, EndpointPolicy> policies = new EnumMap<>(PolicyTier.class);
        Map<String, PolicyTier> endpointTiers = new HashMap<>();
        for (PolicyTier tier : PolicyTier.values()) {
            TierConfig tierConfig = config.tier(tier);
            policies.put(tier, tierConfig.toPolicy());
            for (String endpoint : tierConfig.getEndpoints()) {
                endpointTiers.put(endpoint, tier);
            }
        }
        LOG.info("Endpoint policy table built: {} endpoint(s) across {} tier(s)",
                endpointTiers.size(), policies.size());
        return new EndpointPolicyTable(policies, endpointTiers);
    }

    /**
     * Resolve the base policy for a request.
     *
     * @param endpoint   endpoint name; must not be {@code null}
     * @param privileged whether the subject is privileged
     * @return the base (unscaled) policy
     */
    public EndpointPolicy resolve(String endpoint, boolean privileged) {
        return policyFor(effectiveTier(endpoint, privileged));
    }

    /**
     * @param endpoint   endpoint name
     * @param privileged whether the subject is privileged
     * @return the tier that governs this request
     */
    public PolicyTier effectiveTier(String endpoint, boolean privileged) {
        Objects.requireNonNull(endpoint, "Endpoint must not be null");
        return privileged ? PolicyTier.PRIVILEGED : tierOf(endpoint);
    }

    /**
     * @param endpoint endpoint name
     * @return the configured tier, or {@link PolicyTier#STANDARD} if unknown
     */
    public PolicyTier tierOf(String endpoint) {
        return endpointTiers.getOrDefault(endpoint, PolicyTier.STANDARD);
    }

    public EndpointPolicy policyFor(PolicyTier tier) {
        return policies.get(tier);
    }
}
