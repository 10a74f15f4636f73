package com.abusesentinel.core.config;

import com.abusesentinel.core.model.PolicyTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EngineConfigLoader} and {@link EngineConfig} validation.
 */
class EngineConfigLoaderTest {

    @Test
    @DisplayName("Should load test config from classpath and keep defaults for omitted keys")
    void shouldLoadFromClasspath() {
        EngineConfig config = EngineConfigLoader.fromClasspath("test-engine.yml");

        assertThat(config.getTiers()).hasSize(4);
        TierConfig critical = config.tier(PolicyTier.CRITICAL);
        assertThat(critical.getMaxRequests()).isEqualTo(3);
        assertThat(critical.getEndpoints()).containsExactly("Buy");

        assertThat(config.getThrottle().getViolationThreshold()).isEqualTo(2);
        assertThat(config.getThrottle().getEscalationFactor()).isEqualTo(1.5);
        assertThat(config.getScoring().getMinSamples()).isEqualTo(5);
        assertThat(config.getScoring().getWeights().getMovement()).isEqualTo(0.30);
        assertThat(config.getScoring().getWeights().getAction()).isEqualTo(0.25);
        assertThat(config.getSchedule().getMacroTickMillis()).isEqualTo(5_000);
        assertThat(config.getSchedule().getMicroTickMillis()).isEqualTo(1_000);
    }

    @Test
    @DisplayName("Should ship a default resource matching the built-in defaults")
    void shouldLoadDefaultResource() {
        EngineConfig config = EngineConfigLoader.fromClasspath(EngineConfigLoader.DEFAULT_RESOURCE);
        EngineConfig defaults = EngineConfig.defaults();

        for (PolicyTier tier : PolicyTier.values()) {
            assertThat(config.tier(tier).toPolicy()).isEqualTo(defaults.tier(tier).toPolicy());
        }
        assertThat(config.tier(PolicyTier.CRITICAL).getEndpoints()).contains("PurchaseItem");
    }

    @Test
    @DisplayName("Should accept the built-in defaults")
    void shouldValidateDefaults() {
        assertThatCode(() -> EngineConfig.defaults().validate()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should reject an endpoint assigned to two tiers")
    void shouldRejectOverlappingEndpoints() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("invalid-overlap.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Endpoint 'Buy' is assigned to both 'critical' and 'standard'");
    }

    @Test
    @DisplayName("Should reject a tier declared twice")
    void shouldRejectDuplicateTier() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("invalid-duplicate-tier.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Tier 'critical' is declared more than once");
    }

    @Test
    @DisplayName("Should wrap YAML type errors in IllegalStateException")
    void shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("malformed.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed engine config");
    }

    @Test
    @DisplayName("Should list every problem in one exception")
    void shouldCollectAllErrors() {
        EngineConfig config = EngineConfig.defaults();
        config.setTiers(List.of(
                new TierConfig("critical", 0, 60, 2, 2.0, List.of()),
                new TierConfig("turbo", 5, 60, 2, 2.0, List.of())));
        config.getThrottle().setEscalationFactor(0.5);

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("maxRequests")
                .hasMessageContaining("turbo")
                .hasMessageContaining("escalationFactor");
    }

    @Test
    @DisplayName("Should report a missing tier")
    void shouldRejectMissingTier() {
        EngineConfig config = EngineConfig.defaults();
        config.setTiers(List.of(
                new TierConfig("critical", 5, 60, 2, 2.0, List.of()),
                new TierConfig("standard", 30, 60, 5, 0.5, List.of()),
                new TierConfig("high_frequency", 120, 60, 20, 0.1, List.of())));

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Tier 'privileged' is missing");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when config file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> EngineConfigLoader.fromFile("/nonexistent/abuse-sentinel.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
}
