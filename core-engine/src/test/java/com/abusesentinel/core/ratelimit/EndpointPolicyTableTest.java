package com.abusesentinel.core.ratelimit;

import com.abusesentinel.core.config.EngineConfig;
import com.abusesentinel.core.model.EndpointPolicy;
import com.abusesentinel.core.model.PolicyTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EndpointPolicyTable}.
 */
class EndpointPolicyTableTest {

    private EndpointPolicyTable table;

    @BeforeEach
    void setUp() {
        table = EndpointPolicyTable.fromConfig(EngineConfig.defaults());
    }

    @Test
    @DisplayName("Should resolve configured endpoints to their tier")
    void shouldResolveConfiguredEndpoints() {
        assertThat(table.tierOf("PurchaseItem")).isEqualTo(PolicyTier.CRITICAL);
        assertThat(table.tierOf("PlaceItem")).isEqualTo(PolicyTier.STANDARD);
        assertThat(table.tierOf("UpdatePosition")).isEqualTo(PolicyTier.HIGH_FREQUENCY);

        EndpointPolicy critical = table.resolve("PurchaseItem", false);
        assertThat(critical.getMaxRequests()).isEqualTo(5);
        assertThat(critical.getBurstLimit()).isEqualTo(2);
        assertThat(critical.getCooldownSeconds()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should fall back to the standard tier for unknown endpoints")
    void shouldDefaultToStandard() {
        assertThat(table.tierOf("SomethingNew")).isEqualTo(PolicyTier.STANDARD);
        assertThat(table.resolve("SomethingNew", false)).isEqualTo(table.policyFor(PolicyTier.STANDARD));
    }

    @Test
    @DisplayName("Should apply the privileged tier regardless of endpoint")
    void shouldOverrideForPrivilegedSubjects() {
        assertThat(table.effectiveTier("PurchaseItem", true)).isEqualTo(PolicyTier.PRIVILEGED);
        assertThat(table.resolve("PurchaseItem", true).getMaxRequests()).isEqualTo(1000);
    }

    @Test
    @DisplayName("Should reject a null endpoint")
    void shouldRejectNullEndpoint() {
        assertThatThrownBy(() -> table.resolve(null, false))
                .isInstanceOf(NullPointerException.class);
    }
}
