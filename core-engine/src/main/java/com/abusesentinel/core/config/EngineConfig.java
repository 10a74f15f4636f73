package com.abusesentinel.core.config;

import com.abusesentinel.core.model.PolicyTier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure (every section is optional and falls back to the
 * built-in defaults):
 * </p>
 *
 * <pre>
 * tiers:
 *   - name: critical
 *     maxRequests: 5
 *     windowSeconds: 60
 *     burstLimit: 2
 *     cooldownSeconds: 2.0
 *     endpoints: [PurchaseItem]
 * throttle:
 *   violationThreshold: 3
 * scoring:
 *   minSamples: 10
 *   weights:
 *     action: 0.25
 * schedule:
 *   microTickMillis: 1000
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify the configuration.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig {

    private List<TierConfig> tiers = defaultTiers();
    private ThrottleConfig throttle = new ThrottleConfig();
    private ScoringConfig scoring = new ScoringConfig();
    private ScheduleConfig schedule = new ScheduleConfig();

    /**
     * @return a configuration holding only the built-in defaults
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * Validate every section of this configuration.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        Set<PolicyTier> seen = EnumSet.noneOf(PolicyTier.class);
        Map<String, String> endpointOwners = new HashMap<>();
        boolean malformedTier = false;
        for (int i = 0; i < tiers.size(); i++) {
            TierConfig tier = Objects.requireNonNull(tiers.get(i), "Tier at index " + i + " is null");
            int before = errors.size();
            tier.validate(errors);
            if (errors.size() > before) {
                malformedTier = true;
                continue;
            }
            if (!seen.add(tier.tier())) {
                errors.add("Tier '" + tier.getName() + "' is declared more than once");
            }
            for (String endpoint : tier.getEndpoints()) {
                String previous = endpointOwners.putIfAbsent(endpoint, tier.getName());
                if (previous != null) {
                    errors.add("Endpoint '" + endpoint + "' is assigned to both '" + previous
                            + "' and '" + tier.getName() + "'");
                }
            }
        }
        for (PolicyTier required : PolicyTier.values()) {
            // an unparseable tier may be the one that looks missing
            if (!seen.contains(required) && !malformedTier) {
                errors.add("Tier '" + required.configName() + "' is missing");
            }
        }

        throttle.validate(errors);
        scoring.validate(errors);
        schedule.validate(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * Return the tier configuration for {@code tier}.
     *
     * @param tier the tier to look up
     * @return its configuration
     * @throws IllegalStateException if the tier is not configured
     */
    public TierConfig tier(PolicyTier tier) {
        return tiers.stream()
                .filter(t -> t.getName() != null && t.tier() == tier)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "Tier '" + tier.configName() + "' is not configured"));
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML during deserialization)
    // ---------------------------------------------------------------

    /**
     * @return unmodifiable list of tier configurations
     */
    public List<TierConfig> getTiers() {
        return Collections.unmodifiableList(tiers);
    }

    public void setTiers(List<TierConfig> tiers) {
        this.tiers = tiers != null && !tiers.isEmpty() ? new ArrayList<>(tiers) : defaultTiers();
    }

    public ThrottleConfig getThrottle() {
        return throttle;
    }

    public void setThrottle(ThrottleConfig throttle) {
        this.throttle = throttle != null ? throttle : new ThrottleConfig();
    }

    public ScoringConfig getScoring() {
        return scoring;
    }

    public void setScoring(ScoringConfig scoring) {
        this.scoring = scoring != null ? scoring : new ScoringConfig();
    }

    public ScheduleConfig getSchedule() {
        return schedule;
    }

    public void setSchedule(ScheduleConfig schedule) {
        this.schedule = schedule != null ? schedule : new ScheduleConfig();
    }

    // ---------------------------------------------------------------
    // Defaults
    // ---------------------------------------------------------------

    private static List<TierConfig> defaultTiers() {
        List<TierConfig> defaults = new ArrayList<>();
        defaults.add(new TierConfig("critical", 5, 60, 2, 2.0,
                List.of("PurchaseItem", "BuyItem", "CloneItem")));
        defaults.add(new TierConfig("standard", 30, 60, 5, 0.5,
                List.of("PlaceItem", "MoveItem", "RotateItem", "RemoveItem", "PickupItem")));
        defaults.add(new TierConfig("high_frequency", 120, 60, 20, 0.1,
                List.of("InteractWithItem", "UpdatePosition", "Heartbeat")));
        defaults.add(new TierConfig("privileged", 1000, 60, 100, 0, List.of()));
        return defaults;
    }

    /**
     * @return a deep copy that shares no mutable state with this configuration
     */
    public EngineConfig copy() {
        EngineConfig copy = new EngineConfig();
        copy.tiers = tiers.stream()
                .map(tier -> tier != null ? tier.copy() : null)
                .collect(Collectors.toCollection(ArrayList::new));
        copy.throttle = throttle.copy();
        copy.scoring = scoring.copy();
        copy.schedule = schedule.copy();
        return copy;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "tiers=" + tiers +
                ", throttle=" + throttle +
                ", scoring=" + scoring +
                ", schedule=" + schedule +
                '}';
    }
}
