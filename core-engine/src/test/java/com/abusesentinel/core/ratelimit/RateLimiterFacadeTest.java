package com.abusesentinel.core.ratelimit;

import com.abusesentinel.core.config.EngineConfig;
import com.abusesentinel.core.metrics.EngineMetrics;
import com.abusesentinel.core.model.DenialKind;
import com.abusesentinel.core.model.GateDecision;
import com.abusesentinel.core.model.PolicyTier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RateLimiterFacade}.
 */
class RateLimiterFacadeTest {

    private RateLimiterFacade facade;
    private RateLimitState state;
    private EngineMetrics metrics;

    @BeforeEach
    void setUp() {
        EngineConfig config = EngineConfig.defaults();
        metrics = new EngineMetrics(new SimpleMeterRegistry());
        facade = new RateLimiterFacade(EndpointPolicyTable.fromConfig(config), new SlidingWindowLimiter(),
                new AdaptiveThrottle(config.getThrottle()), metrics);
        state = new RateLimitState();
    }

    @Test
    @DisplayName("Should record allowed requests and tag the decision with its tier")
    void shouldRecordAllowedRequest() {
        GateDecision decision = facade.checkAndRecord("alice", state, "PurchaseItem", false, 0);

        assertThat(decision.isAllowed()).isTrue();
        assertThat(decision.getTier()).contains(PolicyTier.CRITICAL);
        assertThat(state.requests("PurchaseItem")).containsExactly(0L);
        assertThat(metrics.allowedTotal()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should record a violation for every denial")
    void shouldRecordViolationOnDenial() {
        facade.checkAndRecord("alice", state, "PurchaseItem", false, 0);
        GateDecision denied = facade.checkAndRecord("alice", state, "PurchaseItem", false, 500);

        assertThat(denied.isAllowed()).isFalse();
        assertThat(denied.getKind()).contains(DenialKind.COOLDOWN);
        assertThat(state.violations()).singleElement()
                .satisfies(v -> {
                    assertThat(v.getSubjectId()).isEqualTo("alice");
                    assertThat(v.getEndpoint()).isEqualTo("PurchaseItem");
                    assertThat(v.getKind()).isEqualTo(DenialKind.COOLDOWN);
                    assertThat(v.getTimestamp()).isEqualTo(Instant.ofEpochMilli(500));
                });
        assertThat(state.adaptive().getViolationCount()).isEqualTo(1);
        assertThat(metrics.deniedTotal()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should tighten the effective policy once the throttle escalates")
    void shouldApplyEscalatedPolicy() {
        facade.checkAndRecord("bob", state, "PlaceItem", false, 0);
        for (int i = 1; i <= 3; i++) {
            // standard cooldown is 0.5s
            facade.checkAndRecord("bob", state, "PlaceItem", false, i * 10L);
        }
        assertThat(state.adaptive().getThrottleMultiplier()).isEqualTo(1.5);

        // scaled cooldown is 0.75s, so 0.6s after the last allowed request is still too early
        GateDecision decision = facade.checkAndRecord("bob", state, "PlaceItem", false, 600);
        assertThat(decision.isAllowed()).isFalse();
        assertThat(decision.getReason()).startsWith("Cooldown active");

        // that denial escalated again: cooldown is now 0.5s x 2.25
        assertThat(state.adaptive().getThrottleMultiplier()).isEqualTo(2.25);
        assertThat(facade.checkAndRecord("bob", state, "PlaceItem", false, 1_124).isAllowed()).isFalse();
        assertThat(facade.checkAndRecord("bob", state, "PlaceItem", false, 2_000).isAllowed()).isTrue();
    }

    @Test
    @DisplayName("Should gate privileged subjects by the privileged tier")
    void shouldUsePrivilegedTier() {
        for (int i = 0; i < 50; i++) {
            GateDecision decision = facade.checkAndRecord("admin", state, "PurchaseItem", true, i * 20L);
            assertThat(decision.isAllowed()).isTrue();
            assertThat(decision.getTier()).contains(PolicyTier.PRIVILEGED);
        }
        assertThat(state.violations()).isEmpty();
    }
}
